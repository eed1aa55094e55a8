package com.distindex.core.graph;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Weight and volatility of every distribution in a dependency graph.
 *
 * <p><b>Weight</b> is the number of distributions that depend on a distribution,
 * directly or transitively, ignoring umbrella distributions: it is computed on
 * the reversed graph with umbrella nodes removed, so paths through an umbrella
 * node do not count either. Umbrella distributions have weight 0.
 *
 * <p><b>Volatility</b> is the number of distributions a distribution depends on,
 * directly or transitively, over the full graph.
 *
 * <p>Neither count includes the distribution itself.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * GraphMetrics metrics = GraphMetrics.compute(graph, new UmbrellaFilter(List.of("Task-")));
 * int weight = metrics.weight("Test-Simple");
 * }</pre>
 */
public final class GraphMetrics {

    private final Map<String, Integer> weights;
    private final Map<String, Integer> volatilities;

    private GraphMetrics(Map<String, Integer> weights, Map<String, Integer> volatilities) {
        this.weights = Collections.unmodifiableMap(weights);
        this.volatilities = Collections.unmodifiableMap(volatilities);
    }

    /**
     * Computes weight and volatility for every node of {@code graph}.
     *
     * @param graph forward dependency graph, edges from dependent to dependency
     * @param umbrellas umbrella filter applied to weight
     * @return metrics for every node
     */
    public static GraphMetrics compute(DependencyGraph graph, UmbrellaFilter umbrellas) {
        Objects.requireNonNull(graph, "graph must not be null");
        Objects.requireNonNull(umbrellas, "umbrellas must not be null");

        DependencyGraph dependents = graph.without(umbrellas).reversed();
        int[] weightCounts = ReachabilityCalculator.countReachable(dependents);
        Map<String, Integer> weights = new HashMap<>();
        for (int node = 0; node < graph.size(); node++) {
            String name = graph.name(node);
            int id = dependents.indexOf(name);
            weights.put(name, id < 0 ? 0 : weightCounts[id]);
        }

        int[] volatilityCounts = ReachabilityCalculator.countReachable(graph);
        Map<String, Integer> volatilities = new HashMap<>();
        for (int node = 0; node < graph.size(); node++) {
            volatilities.put(graph.name(node), volatilityCounts[node]);
        }
        return new GraphMetrics(weights, volatilities);
    }

    /**
     * Returns the weight of a distribution.
     *
     * @param distribution distribution name
     * @return weight, 0 for unknown distributions
     */
    public int weight(String distribution) {
        return weights.getOrDefault(distribution, 0);
    }

    /**
     * Returns the volatility of a distribution.
     *
     * @param distribution distribution name
     * @return volatility, 0 for unknown distributions
     */
    public int volatility(String distribution) {
        return volatilities.getOrDefault(distribution, 0);
    }

    public Map<String, Integer> weights() {
        return weights;
    }

    public Map<String, Integer> volatilities() {
        return volatilities;
    }
}
