package com.frame.exception;

import com.frame.core.Key;

/**
 * Exception thrown when a task or stage is registered under a key
 * that its owning collection already holds.
 */
public class DuplicateKeyException extends FrameException {

    private final Key key;

    public DuplicateKeyException(Key key, String owner) {
        super("Key '" + key + "' is already registered in " + owner);
        this.key = key;
    }

    public Key getKey() {
        return key;
    }
}
