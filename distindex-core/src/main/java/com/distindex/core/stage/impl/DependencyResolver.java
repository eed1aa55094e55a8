package com.distindex.core.stage.impl;

import com.distindex.core.stage.StageContext;
import com.distindex.core.stage.StageResult;
import com.distindex.core.stage.base.AbstractStage;
import com.distindex.core.store.IndexStore;

/**
 * Resolves module-level dependency declarations into distribution-level edges.
 *
 * <p>Each declared module is replaced by the distribution that provides it.
 * Declarations collapsing onto the same {@code (distribution, dependency, phase)}
 * keep a single row: the one with a core value, the highest core value, then the
 * lexically smallest module name. Declarations of modules no distribution
 * provides produce no edge. Self-edges are kept; the metrics stage ignores them.
 *
 * <p>The flattened {@code requires} table keeps one declaration per
 * {@code (distribution, module, phase)} chosen by the same rule, with the
 * smallest version breaking ties.
 */
public class DependencyResolver extends AbstractStage {

    public static final String STAGE_ID = "resolve-dependencies";
    private static final String STAGE_DISPLAY_NAME = "Resolve dependencies";

    private static final String COUNT_UNRESOLVED =
        "SELECT COUNT(*) FROM t_requires WHERE module NOT IN (SELECT module FROM module)";
    private static final String COUNT_SELF_EDGES =
        "SELECT COUNT(*) FROM dependency WHERE distribution = dependency";

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

        store.executeScript("schema/dependencies.sql");

        log.info("Generating table dependency...");
        store.executeScript("resolve/dependency.sql");
        result.rowCount("dependency", store.count("dependency"));

        log.info("Generating table requires...");
        store.executeScript("resolve/requires.sql");
        result.rowCount("requires", store.count("requires"));

        long unresolved = store.queryFirst(COUNT_UNRESOLVED, rs -> rs.getLong(1)).orElse(0L);
        long selfEdges = store.queryFirst(COUNT_SELF_EDGES, rs -> rs.getLong(1)).orElse(0L);
        log.info("{} declaration(s) name modules outside the index, {} self-edge(s)", unresolved, selfEdges);
    }
}
