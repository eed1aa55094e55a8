package com.distindex.core.stage.impl;

import com.distindex.core.graph.DependencyGraph;
import com.distindex.core.graph.GraphMetrics;
import com.distindex.core.graph.UmbrellaFilter;
import com.distindex.core.stage.StageContext;
import com.distindex.core.stage.StageResult;
import com.distindex.core.stage.base.AbstractStage;
import com.distindex.core.store.IndexStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Computes {@code distribution.weight} and {@code distribution.volatility}.
 *
 * <p>Loads every distribution as a node and every {@code dependency} row as an
 * edge, computes both metrics with {@link GraphMetrics}, and writes the non-zero
 * values back in batches. Columns default to 0, so distributions outside the
 * graph's reach need no update.
 *
 * @see GraphMetrics
 * @see UmbrellaFilter
 */
public class GraphMetricsStage extends AbstractStage {

    public static final String STAGE_ID = "graph-metrics";
    private static final String STAGE_DISPLAY_NAME = "Compute graph metrics";

    private static final String SELECT_NODES =
        "SELECT distribution FROM distribution ORDER BY distribution";
    private static final String SELECT_EDGES =
        "SELECT DISTINCT distribution, dependency FROM dependency";
    private static final String UPDATE_WEIGHT =
        "UPDATE distribution SET weight = ? WHERE distribution = ?";
    private static final String UPDATE_VOLATILITY =
        "UPDATE distribution SET volatility = ? WHERE distribution = ?";

    @Override
    public String getId() {
        return STAGE_ID;
    }

    @Override
    public String getDisplayName() {
        return STAGE_DISPLAY_NAME;
    }

    @Override
    protected void run(StageContext context, StageResult.Builder result) {
        IndexStore store = context.store();
        int batchSize = context.settings().batchSize();

        DependencyGraph graph = loadGraph(store);
        log.debug("Loaded {}", graph);

        UmbrellaFilter umbrellas = new UmbrellaFilter(context.settings().excludedPrefixes());
        GraphMetrics metrics = GraphMetrics.compute(graph, umbrellas);

        log.info("Generating column  distribution.weight...");
        result.rowCount("weight", writeBatched(store, UPDATE_WEIGHT, batchSize, nonZero(metrics.weights())));

        log.info("Generating column  distribution.volatility...");
        result.rowCount("volatility",
            writeBatched(store, UPDATE_VOLATILITY, batchSize, nonZero(metrics.volatilities())));
    }

    private DependencyGraph loadGraph(IndexStore store) {
        DependencyGraph.Builder builder = DependencyGraph.builder();
        for (String name : store.query(SELECT_NODES, rs -> rs.getString(1))) {
            builder.addNode(name);
        }
        for (String[] edge : store.query(SELECT_EDGES, rs -> new String[]{rs.getString(1), rs.getString(2)})) {
            builder.addEdge(edge[0], edge[1]);
        }
        return builder.build();
    }

    private static List<Object[]> nonZero(Map<String, Integer> values) {
        List<Object[]> rows = new ArrayList<>();
        values.forEach((distribution, value) -> {
            if (value > 0) {
                rows.add(new Object[]{value, distribution});
            }
        });
        return rows;
    }
}
