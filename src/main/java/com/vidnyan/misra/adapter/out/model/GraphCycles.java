package com.vidnyan.misra.adapter.out.model;

import java.util.function.IntFunction;

/**
 * Cycle detection over arena-indexed edges. Out-of-range targets are
 * treated as absent.
 */
final class GraphCycles {

    static final int NONE = -1;

    private static final byte UNSEEN = 0;
    private static final byte ON_PATH = 1;
    private static final byte DONE = 2;

    private GraphCycles() {
    }

    /**
     * Index of a node lying on a cycle, or {@link #NONE} when the graph is acyclic.
     */
    static int nodeOnCycle(int size, IntFunction<int[]> edges) {
        byte[] state = new byte[size];
        int[] stack = new int[size];
        int[] nextEdge = new int[size];
        for (int root = 0; root < size; root++) {
            if (state[root] != UNSEEN) {
                continue;
            }
            int depth = 0;
            stack[0] = root;
            nextEdge[0] = 0;
            state[root] = ON_PATH;
            while (depth >= 0) {
                int node = stack[depth];
                int[] out = edges.apply(node);
                if (nextEdge[depth] == out.length) {
                    state[node] = DONE;
                    depth--;
                    continue;
                }
                int target = out[nextEdge[depth]++];
                if (target < 0 || target >= size) {
                    continue;
                }
                if (state[target] == ON_PATH) {
                    return target;
                }
                if (state[target] == UNSEEN) {
                    state[target] = ON_PATH;
                    depth++;
                    stack[depth] = target;
                    nextEdge[depth] = 0;
                }
            }
        }
        return NONE;
    }
}
