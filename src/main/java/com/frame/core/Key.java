package com.frame.core;

import java.util.Objects;

/**
 * Identifier of a task or stage.
 * <p>
 * Named keys ({@link #of(String)}) are equal whenever their names are equal, so
 * separate modules can refer to the same shared stage. Unique keys
 * ({@link #unique(String)}) are equal only to themselves; the name is kept for
 * diagnostics.
 */
public final class Key {

    private final String name;
    private final boolean unique;

    private Key(String name, boolean unique) {
        this.name = Objects.requireNonNull(name, "Key name cannot be null");
        this.unique = unique;
    }

    /**
     * Create a named key.
     */
    public static Key of(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Key name cannot be null or blank");
        }
        return new Key(name, false);
    }

    /**
     * Create a key that is distinct from every other key, including other
     * unique keys with the same name.
     */
    public static Key unique(String name) {
        return new Key(name, true);
    }

    public String name() {
        return name;
    }

    public boolean isUnique() {
        return unique;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Key other)) {
            return false;
        }
        return !unique && !other.unique && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return unique ? System.identityHashCode(this) : name.hashCode();
    }

    @Override
    public String toString() {
        return unique ? name + "#" + Integer.toHexString(System.identityHashCode(this)) : name;
    }
}
