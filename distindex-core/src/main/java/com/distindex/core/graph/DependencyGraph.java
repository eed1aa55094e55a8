package com.distindex.core.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * Immutable directed graph over distribution names.
 *
 * <p>Nodes are addressed by dense integer IDs in insertion order; each node's
 * successors are kept as a sorted, duplicate-free array. Self-edges are dropped
 * when the graph is built: a distribution depending on itself adds nothing to
 * any reachability count.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * DependencyGraph graph = DependencyGraph.builder()
 *     .addNode("Foo")
 *     .addNode("Bar")
 *     .addEdge("Foo", "Bar")
 *     .build();
 * int[] dependents = ReachabilityCalculator.countReachable(graph.reversed());
 * }</pre>
 */
public final class DependencyGraph {

    private final List<String> names;
    private final Map<String, Integer> ids;
    private final int[][] successors;
    private final long edgeCount;

    private DependencyGraph(List<String> names, Map<String, Integer> ids, int[][] successors) {
        this.names = names;
        this.ids = ids;
        this.successors = successors;
        long edges = 0;
        for (int[] targets : successors) {
            edges += targets.length;
        }
        this.edgeCount = edges;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the number of nodes.
     *
     * @return node count
     */
    public int size() {
        return names.size();
    }

    /**
     * Returns the number of distinct edges, self-edges excluded.
     *
     * @return edge count
     */
    public long edgeCount() {
        return edgeCount;
    }

    /**
     * Returns the name of a node.
     *
     * @param node node ID
     * @return distribution name
     */
    public String name(int node) {
        return names.get(node);
    }

    /**
     * Returns every node name in ID order.
     *
     * @return unmodifiable list of names
     */
    public List<String> names() {
        return names;
    }

    /**
     * Looks up the ID of a node.
     *
     * @param name distribution name
     * @return node ID, or -1 if the graph has no such node
     */
    public int indexOf(String name) {
        Integer id = ids.get(name);
        return id == null ? -1 : id;
    }

    /**
     * Returns the successors of a node. The returned array must not be modified.
     *
     * @param node node ID
     * @return sorted successor IDs
     */
    int[] successors(int node) {
        return successors[node];
    }

    /**
     * Returns the successor names of a node.
     *
     * @param name distribution name
     * @return successor names, empty if the node is unknown
     */
    public List<String> successorsOf(String name) {
        int node = indexOf(name);
        if (node < 0) {
            return List.of();
        }
        List<String> result = new ArrayList<>(successors[node].length);
        for (int target : successors[node]) {
            result.add(names.get(target));
        }
        return result;
    }

    /**
     * Returns the graph with every edge reversed. Node IDs are preserved.
     *
     * @return reversed graph
     */
    public DependencyGraph reversed() {
        int[] inDegree = new int[size()];
        for (int[] targets : successors) {
            for (int target : targets) {
                inDegree[target]++;
            }
        }
        int[][] reversed = new int[size()][];
        for (int node = 0; node < size(); node++) {
            reversed[node] = new int[inDegree[node]];
        }
        int[] fill = new int[size()];
        // Sources are visited in ascending order, so each reversed list comes out sorted.
        for (int source = 0; source < size(); source++) {
            for (int target : successors[source]) {
                reversed[target][fill[target]++] = source;
            }
        }
        return new DependencyGraph(names, ids, reversed);
    }

    /**
     * Returns the subgraph without the nodes matching {@code excluded}, and
     * without every edge touching them. Remaining nodes are renumbered.
     *
     * @param excluded predicate on node names
     * @return induced subgraph
     */
    public DependencyGraph without(Predicate<String> excluded) {
        Builder builder = builder();
        for (String name : names) {
            if (!excluded.test(name)) {
                builder.addNode(name);
            }
        }
        for (int source = 0; source < size(); source++) {
            if (excluded.test(names.get(source))) {
                continue;
            }
            for (int target : successors[source]) {
                if (!excluded.test(names.get(target))) {
                    builder.addEdge(names.get(source), names.get(target));
                }
            }
        }
        return builder.build();
    }

    @Override
    public String toString() {
        return "DependencyGraph[nodes=" + size() + ", edges=" + edgeCount + "]";
    }

    /**
     * Builder collecting nodes and edges by name.
     */
    public static final class Builder {
        private final List<String> names = new ArrayList<>();
        private final Map<String, Integer> ids = new HashMap<>();
        private final List<Set<Integer>> edges = new ArrayList<>();

        private Builder() {
        }

        /**
         * Adds a node; adding a known name again has no effect.
         *
         * @param name distribution name
         * @return this builder
         */
        public Builder addNode(String name) {
            Objects.requireNonNull(name, "name must not be null");
            if (!ids.containsKey(name)) {
                ids.put(name, names.size());
                names.add(name);
                edges.add(new TreeSet<>());
            }
            return this;
        }

        /**
         * Adds an edge between two known nodes. Self-edges and repeated edges are ignored.
         *
         * @param from depending distribution
         * @param to distribution depended upon
         * @return this builder
         * @throws IllegalArgumentException if either endpoint is not a node
         */
        public Builder addEdge(String from, String to) {
            int source = require(from);
            int target = require(to);
            if (source != target) {
                edges.get(source).add(target);
            }
            return this;
        }

        public DependencyGraph build() {
            int[][] successors = new int[names.size()][];
            for (int node = 0; node < names.size(); node++) {
                successors[node] = edges.get(node).stream().mapToInt(Integer::intValue).toArray();
            }
            return new DependencyGraph(
                Collections.unmodifiableList(new ArrayList<>(names)),
                Map.copyOf(ids),
                successors
            );
        }

        private int require(String name) {
            Integer id = ids.get(name);
            if (id == null) {
                throw new IllegalArgumentException("Unknown node: " + name);
            }
            return id;
        }
    }
}
