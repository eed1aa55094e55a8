package com.distindex.core.stage.impl;

import com.distindex.core.config.PipelineSettings;
import com.distindex.core.model.CoverageReport;
import com.distindex.core.stage.StageContext;
import com.distindex.core.stage.StageResult;
import com.distindex.core.stage.base.AbstractStage;
import com.distindex.core.store.IndexStore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finishes the store: indexes, coverage report, cleanup.
 *
 * <p>Creates one single-column index per queried column, named
 * {@code <table>__<column>}, reports how many distributions each secondary
 * source covered, drops the staging tables unless they are to be kept, and
 * finally compacts the file and refreshes planner statistics as configured.
 */
public class IndexingStage extends AbstractStage {

    public static final String STAGE_ID = "index";
    private static final String STAGE_DISPLAY_NAME = "Index and finalize";

    /**
     * Indexed columns per table, in creation order.
     */
    static final Map<String, List<String>> INDEXES = indexes();

    /**
     * Staging tables created by the normalizer.
     */
    static final List<String> STAGING_TABLES = List.of(
        "t_author", "t_distribution", "t_module", "t_requires", "t_uploaded",
        "t_testers", "t_rating", "t_meta", "t_ticket"
    );

    public static final String COVERAGE_DISTRIBUTIONS = "coverage.distributions";
    public static final String COVERAGE_UPLOADED = "coverage.uploaded";
    public static final String COVERAGE_META = "coverage.meta";
    public static final String COVERAGE_RATING = "coverage.rating";
    public static final String COVERAGE_TESTED = "coverage.tested";

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
        PipelineSettings settings = context.settings();

        INDEXES.forEach((table, columns) -> store.createIndex(table, columns.toArray(new String[0])));

        CoverageReport coverage = measureCoverage(store);
        log.info("Coverage for column uploaded = {}", coverage.uploaded());
        log.info("Coverage for column meta = {}", coverage.meta());
        log.info("Coverage for column rating = {}", coverage.rated());
        log.info("Coverage for column pass = {}", coverage.tested());
        result.rowCount(COVERAGE_DISTRIBUTIONS, coverage.distributions())
            .rowCount(COVERAGE_UPLOADED, coverage.uploaded())
            .rowCount(COVERAGE_META, coverage.meta())
            .rowCount(COVERAGE_RATING, coverage.rated())
            .rowCount(COVERAGE_TESTED, coverage.tested());

        if (settings.keepStagingTables()) {
            log.info("Keeping staging tables");
        } else {
            log.info("Dropping excess tables...");
            STAGING_TABLES.forEach(store::dropTable);
        }

        if (settings.vacuum()) {
            log.info("Freeing excess space...");
            store.vacuum();
        }
        if (settings.analyze()) {
            log.info("Optimising indexes...");
            store.analyze();
        }
    }

    /**
     * Counts how many distributions each secondary source filled in.
     *
     * @param store finished store
     * @return coverage counts
     */
    public static CoverageReport measureCoverage(IndexStore store) {
        return new CoverageReport(
            store.count("distribution"),
            countWhere(store, "uploaded IS NOT NULL"),
            countWhere(store, "meta = 1"),
            countWhere(store, "rating IS NOT NULL"),
            countWhere(store, "pass IS NOT NULL OR fail IS NOT NULL OR unknown IS NOT NULL OR na IS NOT NULL")
        );
    }

    private static long countWhere(IndexStore store, String condition) {
        return store.queryFirst("SELECT COUNT(*) FROM distribution WHERE " + condition, rs -> rs.getLong(1))
            .orElse(0L);
    }

    private static Map<String, List<String>> indexes() {
        Map<String, List<String>> indexes = new LinkedHashMap<>();
        indexes.put("author", List.of("name"));
        indexes.put("distribution", List.of(
            "release", "version", "author", "meta", "license", "pass", "fail", "unknown", "na",
            "uploaded", "rating", "ratings", "weight", "volatility"));
        indexes.put("module", List.of("version", "distribution"));
        indexes.put("dependency", List.of("distribution", "dependency", "phase", "core"));
        indexes.put("requires", List.of("distribution", "module", "version", "phase"));
        indexes.put("ticket", List.of("distribution", "status", "severity"));
        return Collections.unmodifiableMap(indexes);
    }
}
