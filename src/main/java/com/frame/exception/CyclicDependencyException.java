package com.frame.exception;

import com.frame.core.Key;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Exception thrown when before/after constraints form a cycle.
 * The cached order of the owning stage or scheduler is left untouched.
 */
public class CyclicDependencyException extends FrameException {

    private final List<Key> cycle;

    public CyclicDependencyException(List<Key> cycle) {
        super("Cyclic dependency detected: " + describe(cycle));
        this.cycle = List.copyOf(cycle);
    }

    /**
     * Keys forming the cycle, in dependency order. The first key is
     * repeated implicitly at the end.
     */
    public List<Key> getCycle() {
        return cycle;
    }

    private static String describe(List<Key> cycle) {
        if (cycle.isEmpty()) {
            return "[]";
        }
        return cycle.stream().map(Key::toString).collect(Collectors.joining(" -> "))
                + " -> " + cycle.get(0);
    }
}
