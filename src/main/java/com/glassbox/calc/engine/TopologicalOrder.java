package com.glassbox.calc.engine;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Kahn ordering over integer keys, with the child lists kept in CSR form.
 *
 * Data layout:
 * - order: keys in evaluation order. Only keys whose every parent was placed
 * appear here.
 * - unresolved: keys never placed because they sit on, or below, a cycle.
 * - childrenOffset / childrenList: children of the node at insertion index i
 * are childrenList[childrenOffset[i]] .. childrenList[childrenOffset[i+1]-1],
 * stored as insertion indices.
 *
 * The queue is FIFO and seeded in insertion order, so the result is
 * deterministic for a given sequence of addNode/addEdge calls.
 */
public final class TopologicalOrder {
    private final int[] keys;
    private final int[] order;
    private final int[] unresolved;
    private final int[] childrenOffset;
    private final int[] childrenList;
    private final int[] parentCount;
    private final Map<Integer, Integer> keyToIndex;

    private TopologicalOrder(int[] keys, int[] order, int[] unresolved, int[] childrenOffset, int[] childrenList,
            int[] parentCount, Map<Integer, Integer> keyToIndex) {
        this.keys = keys;
        this.order = order;
        this.unresolved = unresolved;
        this.childrenOffset = childrenOffset;
        this.childrenList = childrenList;
        this.parentCount = parentCount;
        this.keyToIndex = keyToIndex;
    }

    public int nodeCount() {
        return keys.length;
    }

    /** Keys in evaluation order. */
    public int[] order() {
        return order.clone();
    }

    /** Keys left with unplaced parents, in insertion order. */
    public int[] unresolved() {
        return unresolved.clone();
    }

    public boolean isComplete() {
        return unresolved.length == 0;
    }

    public int key(int index) {
        return keys[index];
    }

    /** Insertion index of a key. */
    public int index(int key) {
        Integer idx = keyToIndex.get(key);
        if (idx == null)
            throw new IllegalArgumentException("Unknown node: " + key);
        return idx;
    }

    public boolean contains(int key) {
        return keyToIndex.containsKey(key);
    }

    public int childCount(int index) {
        return childrenOffset[index + 1] - childrenOffset[index];
    }

    /** Key of the i-th child of the node at {@code index}. */
    public int childKey(int index, int i) {
        return keys[childrenList[childrenOffset[index] + i]];
    }

    public int parentCount(int index) {
        return parentCount[index];
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<Integer> keys = new ArrayList<>();
        private final Map<Integer, Integer> keyToIdx = new HashMap<>();
        private final List<Set<Integer>> forwardEdges = new ArrayList<>();

        public Builder addNode(int key) {
            if (keyToIdx.containsKey(key))
                throw new IllegalArgumentException("Duplicate node: " + key);
            keyToIdx.put(key, keys.size());
            keys.add(key);
            forwardEdges.add(new LinkedHashSet<>());
            return this;
        }

        /**
         * {@code from} must be placed before {@code to}. A self-edge is allowed
         * and leaves the node unresolved.
         */
        public Builder addEdge(int from, int to) {
            forwardEdges.get(requireIndex(from)).add(requireIndex(to));
            return this;
        }

        public boolean contains(int key) {
            return keyToIdx.containsKey(key);
        }

        private int requireIndex(int key) {
            Integer idx = keyToIdx.get(key);
            if (idx == null)
                throw new IllegalArgumentException("Unknown node: " + key);
            return idx;
        }

        public TopologicalOrder build() {
            int n = keys.size();
            int[] inDegree = new int[n];

            for (Set<Integer> children : forwardEdges)
                for (int child : children)
                    inDegree[child]++;

            int[] queue = new int[n];
            int head = 0, tail = 0;
            for (int i = 0; i < n; i++)
                if (inDegree[i] == 0)
                    queue[tail++] = i;

            boolean[] placed = new boolean[n];
            while (head < tail) {
                int curr = queue[head++];
                placed[curr] = true;
                for (int child : forwardEdges.get(curr))
                    if (--inDegree[child] == 0)
                        queue[tail++] = child;
            }

            int[] keyArr = new int[n];
            for (int i = 0; i < n; i++)
                keyArr[i] = keys.get(i);
            int[] order = new int[tail];
            for (int i = 0; i < tail; i++)
                order[i] = keyArr[queue[i]];
            int[] unresolved = new int[n - tail];
            for (int i = 0, u = 0; i < n; i++)
                if (!placed[i])
                    unresolved[u++] = keyArr[i];

            int[] offsets = new int[n + 1];
            for (int i = 0; i < n; i++)
                offsets[i + 1] = offsets[i] + forwardEdges.get(i).size();
            int[] flatChildren = new int[offsets[n]];
            int[] parentCounts = new int[n];
            for (int i = 0; i < n; i++) {
                int j = offsets[i];
                for (int child : forwardEdges.get(i)) {
                    flatChildren[j++] = child;
                    parentCounts[child]++;
                }
            }
            return new TopologicalOrder(keyArr, order, unresolved, offsets, flatChildren, parentCounts,
                    new HashMap<>(keyToIdx));
        }
    }
}
