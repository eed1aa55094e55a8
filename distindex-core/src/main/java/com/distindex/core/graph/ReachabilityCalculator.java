package com.distindex.core.graph;

import java.util.Arrays;

/**
 * Counts, for every node, how many other nodes it can reach.
 *
 * <p>The graph may contain cycles. Nodes are first grouped into strongly
 * connected components with Tarjan's algorithm; every node of a component
 * reaches exactly the same set of nodes. Tarjan emits a component only after
 * every component reachable from it, so the reachable set of each component is
 * assembled once, in emission order, from the already known sets of its
 * successor components.
 *
 * <p>Reachable sets are memoized as deltas: a component stores the components
 * it adds on top of the set of one successor (the one reaching most nodes). A
 * component with a single successor component therefore costs constant time and
 * space, which keeps long dependency chains linear.
 *
 * <p>Both passes use explicit stacks, so chains of any depth are handled without
 * recursion.
 *
 * <p>Counts exclude the node itself, including for nodes on a cycle.
 */
public final class ReachabilityCalculator {

    private static final int NONE = -1;

    private ReachabilityCalculator() {
        // Utility class
    }

    /**
     * Computes the reachable-node count of every node.
     *
     * @param graph graph to analyze
     * @return counts indexed by node ID
     */
    public static int[] countReachable(DependencyGraph graph) {
        int n = graph.size();
        Components components = findComponents(graph);
        int count = components.count;
        int[][] members = components.members(n);

        int[][] delta = new int[count][];
        int[] parent = new int[count];
        long[] total = new long[count];

        int[] successorMark = new int[count];
        int[] setMark = new int[count];
        Arrays.fill(successorMark, NONE);
        Arrays.fill(setMark, NONE);
        int[] successors = new int[count];
        int[] buffer = new int[count];

        for (int c = 0; c < count; c++) {
            int successorCount = 0;
            int best = NONE;
            for (int node : members[c]) {
                for (int target : graph.successors(node)) {
                    int d = components.id[target];
                    if (d != c && successorMark[d] != c) {
                        successorMark[d] = c;
                        successors[successorCount++] = d;
                        if (best == NONE || total[d] > total[best]) {
                            best = d;
                        }
                    }
                }
            }

            parent[c] = best;
            if (successorCount <= 1) {
                delta[c] = new int[]{c};
                total[c] = members[c].length + (best == NONE ? 0 : total[best]);
                continue;
            }

            markSet(best, c, delta, parent, setMark);
            int size = 0;
            buffer[size++] = c;
            long added = members[c].length;
            for (int i = 0; i < successorCount; i++) {
                int d = successors[i];
                if (d == best) {
                    continue;
                }
                // A component already in the set brings its whole reachable set with it.
                for (int e = d; e != NONE && setMark[e] != c; e = parent[e]) {
                    for (int member : delta[e]) {
                        if (setMark[member] != c) {
                            setMark[member] = c;
                            buffer[size++] = member;
                            added += members[member].length;
                        }
                    }
                }
            }
            delta[c] = Arrays.copyOf(buffer, size);
            total[c] = total[best] + added;
        }

        int[] counts = new int[n];
        for (int node = 0; node < n; node++) {
            counts[node] = (int) (total[components.id[node]] - 1);
        }
        return counts;
    }

    private static void markSet(int component, int stamp, int[][] delta, int[] parent, int[] setMark) {
        for (int e = component; e != NONE; e = parent[e]) {
            for (int member : delta[e]) {
                setMark[member] = stamp;
            }
        }
    }

    /**
     * Iterative Tarjan. Components are numbered in emission order, which is a
     * reverse topological order of the condensation.
     */
    static Components findComponents(DependencyGraph graph) {
        int n = graph.size();
        int[] index = new int[n];
        int[] low = new int[n];
        boolean[] onStack = new boolean[n];
        int[] stack = new int[n];
        int[] callNode = new int[n];
        int[] callEdge = new int[n];
        int[] component = new int[n];
        Arrays.fill(index, -1);

        int nextIndex = 0;
        int stackTop = 0;
        int componentCount = 0;

        for (int root = 0; root < n; root++) {
            if (index[root] != -1) {
                continue;
            }
            int depth = 0;
            callNode[0] = root;
            callEdge[0] = 0;
            index[root] = low[root] = nextIndex++;
            stack[stackTop++] = root;
            onStack[root] = true;

            while (depth >= 0) {
                int v = callNode[depth];
                int[] targets = graph.successors(v);
                if (callEdge[depth] < targets.length) {
                    int w = targets[callEdge[depth]++];
                    if (index[w] == -1) {
                        index[w] = low[w] = nextIndex++;
                        stack[stackTop++] = w;
                        onStack[w] = true;
                        depth++;
                        callNode[depth] = w;
                        callEdge[depth] = 0;
                    } else if (onStack[w]) {
                        low[v] = Math.min(low[v], index[w]);
                    }
                    continue;
                }
                if (low[v] == index[v]) {
                    int w;
                    do {
                        w = stack[--stackTop];
                        onStack[w] = false;
                        component[w] = componentCount;
                    } while (w != v);
                    componentCount++;
                }
                depth--;
                if (depth >= 0) {
                    int parent = callNode[depth];
                    low[parent] = Math.min(low[parent], low[v]);
                }
            }
        }
        return new Components(component, componentCount);
    }

    static final class Components {
        final int[] id;
        final int count;

        Components(int[] id, int count) {
            this.id = id;
            this.count = count;
        }

        int[][] members(int n) {
            int[] sizes = new int[count];
            for (int node = 0; node < n; node++) {
                sizes[id[node]]++;
            }
            int[][] members = new int[count][];
            for (int c = 0; c < count; c++) {
                members[c] = new int[sizes[c]];
            }
            int[] fill = new int[count];
            for (int node = 0; node < n; node++) {
                members[id[node]][fill[id[node]]++] = node;
            }
            return members;
        }
    }
}
