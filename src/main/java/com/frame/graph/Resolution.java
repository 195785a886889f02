package com.frame.graph;

import com.frame.core.Key;

import java.util.List;
import java.util.Set;

/**
 * Result of a successful dependency resolution.
 *
 * @param order                Every item exactly once, in a valid topological order
 * @param unresolvedReferences Constraint keys that named no item in the collection
 * @param <T>                  Item type
 */
public record Resolution<T extends Dependent>(
        List<T> order,
        Set<Key> unresolvedReferences
) {
    public static <T extends Dependent> Resolution<T> empty() {
        return new Resolution<>(List.of(), Set.of());
    }

    /**
     * Keys of the resolved items, in order.
     */
    public List<Key> keys() {
        return order.stream().map(Dependent::key).toList();
    }
}
