package com.frame.graph;

import com.frame.core.Key;

import java.util.Set;

/**
 * An item that takes part in dependency resolution.
 */
public interface Dependent {

    Key key();

    /**
     * Keys of items that must come after this one.
     */
    Set<Key> before();

    /**
     * Keys of items that must come before this one.
     */
    Set<Key> after();
}
