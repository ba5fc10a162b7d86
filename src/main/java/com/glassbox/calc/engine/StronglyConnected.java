package com.glassbox.calc.engine;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

/**
 * Tarjan's strongly connected components over a graph of {@code n} nodes
 * given as adjacency lists. Iterative, so long dependency chains do not
 * exhaust the call stack.
 */
final class StronglyConnected {

    private StronglyConnected() {
    }

    /**
     * Components in reverse topological order of the condensation; members of
     * each component are sorted by node index.
     */
    static List<int[]> components(List<int[]> adjacency) {
        int n = adjacency.size();
        int[] index = new int[n], low = new int[n], edgePos = new int[n];
        boolean[] onStack = new boolean[n];
        Arrays.fill(index, -1);
        Deque<Integer> stack = new ArrayDeque<>();
        Deque<Integer> call = new ArrayDeque<>();
        List<int[]> out = new ArrayList<>();
        int counter = 0;

        for (int root = 0; root < n; root++) {
            if (index[root] >= 0)
                continue;
            call.push(root);
            while (!call.isEmpty()) {
                int v = call.peek();
                if (index[v] < 0) {
                    index[v] = low[v] = counter++;
                    stack.push(v);
                    onStack[v] = true;
                }
                int[] adj = adjacency.get(v);
                if (edgePos[v] < adj.length) {
                    int w = adj[edgePos[v]++];
                    if (index[w] < 0) {
                        call.push(w);
                    } else if (onStack[w]) {
                        low[v] = Math.min(low[v], index[w]);
                    }
                    continue;
                }
                call.pop();
                if (!call.isEmpty()) {
                    int parent = call.peek();
                    low[parent] = Math.min(low[parent], low[v]);
                }
                if (low[v] == index[v]) {
                    List<Integer> comp = new ArrayList<>();
                    int w;
                    do {
                        w = stack.pop();
                        onStack[w] = false;
                        comp.add(w);
                    } while (w != v);
                    int[] members = comp.stream().mapToInt(Integer::intValue).sorted().toArray();
                    out.add(members);
                }
            }
        }
        return out;
    }
}
