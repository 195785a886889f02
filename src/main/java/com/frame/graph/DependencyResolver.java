package com.frame.graph;

import com.frame.core.Key;
import com.frame.exception.CyclicDependencyException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Turns before/after constraints into a total order.
 * <p>
 * Kahn's algorithm with the ready set kept as a min-heap on registration
 * index: items without a relative constraint keep their registration order.
 * Constraints naming a key that is not in the collection are ignored and
 * reported in {@link Resolution#unresolvedReferences()}.
 */
public final class DependencyResolver {

    private DependencyResolver() {
    }

    /**
     * Resolve the order of the given items.
     *
     * @param items Items in registration order, keys must be distinct
     * @return Resolved order
     * @throws CyclicDependencyException if the constraints contain a cycle
     */
    public static <T extends Dependent> Resolution<T> resolve(List<T> items) {
        int size = items.size();
        if (size == 0) {
            return Resolution.empty();
        }

        Map<Key, Integer> indexByKey = new HashMap<>(size * 2);
        for (int i = 0; i < size; i++) {
            Key key = items.get(i).key();
            if (indexByKey.putIfAbsent(key, i) != null) {
                throw new IllegalArgumentException("Duplicate key in resolution input: " + key);
            }
        }

        List<Set<Integer>> successors = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            successors.add(new LinkedHashSet<>());
        }
        int[] inDegree = new int[size];
        Set<Key> unresolved = new LinkedHashSet<>();

        for (int i = 0; i < size; i++) {
            T item = items.get(i);
            for (Key afterKey : item.after()) {
                Integer from = indexByKey.get(afterKey);
                if (from == null) {
                    unresolved.add(afterKey);
                } else if (successors.get(from).add(i)) {
                    inDegree[i]++;
                }
            }
            for (Key beforeKey : item.before()) {
                Integer to = indexByKey.get(beforeKey);
                if (to == null) {
                    unresolved.add(beforeKey);
                } else if (successors.get(i).add(to)) {
                    inDegree[to]++;
                }
            }
        }

        PriorityQueue<Integer> ready = new PriorityQueue<>();
        for (int i = 0; i < size; i++) {
            if (inDegree[i] == 0) {
                ready.add(i);
            }
        }

        List<T> order = new ArrayList<>(size);
        while (!ready.isEmpty()) {
            int current = ready.poll();
            order.add(items.get(current));
            for (int next : successors.get(current)) {
                if (--inDegree[next] == 0) {
                    ready.add(next);
                }
            }
        }

        if (order.size() < size) {
            throw new CyclicDependencyException(findCycle(items, successors, inDegree));
        }

        return new Resolution<>(
                Collections.unmodifiableList(order),
                Collections.unmodifiableSet(unresolved));
    }

    /**
     * Every item left after the sort still has an unsatisfied predecessor that
     * was also left over, so following predecessors must eventually revisit a node.
     */
    private static <T extends Dependent> List<Key> findCycle(List<T> items,
                                                             List<Set<Integer>> successors,
                                                             int[] inDegree) {
        int start = -1;
        for (int i = 0; i < inDegree.length; i++) {
            if (inDegree[i] > 0) {
                start = i;
                break;
            }
        }

        Map<Integer, Integer> path = new LinkedHashMap<>();
        int current = start;
        while (!path.containsKey(current)) {
            path.put(current, path.size());
            current = leftoverPredecessor(current, successors, inDegree);
        }

        List<Integer> walked = new ArrayList<>(path.keySet());
        List<Integer> loop = walked.subList(path.get(current), walked.size());
        List<Key> cycle = new ArrayList<>(loop.size());
        for (int i = loop.size() - 1; i >= 0; i--) {
            cycle.add(items.get(loop.get(i)).key());
        }
        return cycle;
    }

    private static int leftoverPredecessor(int node, List<Set<Integer>> successors, int[] inDegree) {
        for (int i = 0; i < inDegree.length; i++) {
            if (inDegree[i] > 0 && successors.get(i).contains(node)) {
                return i;
            }
        }
        throw new IllegalStateException("No remaining predecessor for node " + node);
    }
}
