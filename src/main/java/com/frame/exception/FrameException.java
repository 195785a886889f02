package com.frame.exception;

/**
 * Base exception for the frame scheduling engine.
 */
public class FrameException extends RuntimeException {

    public FrameException(String message) {
        super(message);
    }

    public FrameException(String message, Throwable cause) {
        super(message, cause);
    }
}
