package com.distindex.core.stage.impl;

import com.distindex.core.stage.StageContext;
import com.distindex.core.stage.StageResult;
import com.distindex.core.stage.base.AbstractStage;
import com.distindex.core.store.IndexStore;
import com.distindex.core.store.RowMapper;

import java.util.List;

/**
 * Builds the entity tables from the staging tables.
 *
 * <p>Produces, in order:
 * <ol>
 *   <li>{@code author}, one row per author ID</li>
 *   <li>{@code distribution}, one row per distribution name, left-joined with
 *       upload dates and tester summaries so that every release appears whether
 *       or not the secondary sources know about it</li>
 *   <li>ratings and metadata backfills on {@code distribution}</li>
 *   <li>{@code module}, restricted to modules of known distributions</li>
 *   <li>{@code ticket}</li>
 * </ol>
 *
 * <p>When the package index lists a distribution name twice, the first release
 * in extract order wins. Backfill rows that match no distribution are counted
 * and reported as a warning; they never fail the stage.
 */
public class EntityMerger extends AbstractStage {

    public static final String STAGE_ID = "merge-entities";
    private static final String STAGE_DISPLAY_NAME = "Merge entities";

    private static final String SELECT_RATINGS =
        "SELECT rating, ratings, distribution FROM t_rating ORDER BY rowid";
    private static final String UPDATE_RATING =
        "UPDATE distribution SET rating = ?, ratings = ? WHERE distribution = ?";
    private static final String SELECT_META =
        "SELECT meta, license, release FROM t_meta ORDER BY rowid";
    private static final String UPDATE_META =
        "UPDATE distribution SET meta = ?, license = ? WHERE release = ?";

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

        store.executeScript("schema/entities.sql");

        log.info("Generating table author...");
        store.executeScript("merge/author.sql");
        result.rowCount("author", store.count("author"));

        log.info("Generating table distribution...");
        store.executeScript("merge/distribution.sql");
        long distributions = store.count("distribution");
        result.rowCount("distribution", distributions);
        reportSkippedReleases(store, result, distributions);

        log.info("Populating ratings...");
        backfill(store, result, "ratings", SELECT_RATINGS, UPDATE_RATING, batchSize,
            rs -> new Object[]{rs.getString(1), rs.getInt(2), rs.getString(3)});

        log.info("Populating package metadata...");
        backfill(store, result, "meta", SELECT_META, UPDATE_META, batchSize,
            rs -> new Object[]{rs.getInt(1), rs.getString(2), rs.getString(3)});

        log.info("Generating table module...");
        store.executeScript("merge/module.sql");
        result.rowCount("module", store.count("module"));

        log.info("Generating table ticket...");
        store.executeScript("merge/ticket.sql");
        result.rowCount("ticket", store.count("ticket"));
    }

    private void reportSkippedReleases(IndexStore store, StageResult.Builder result, long distributions) {
        long staged = store.count("t_distribution");
        long names = store.queryFirst("SELECT COUNT(DISTINCT dist) FROM t_distribution", rs -> rs.getLong(1))
            .orElse(0L);
        if (staged > names) {
            log.info("{} duplicate release(s) ignored, first release per distribution kept", staged - names);
        }
        if (names > distributions) {
            warn(result, (names - distributions) + " distribution(s) skipped: author not in package index");
        }
    }

    private void backfill(
            IndexStore store,
            StageResult.Builder result,
            String name,
            String select,
            String update,
            int batchSize,
            RowMapper<Object[]> mapper) {
        List<Object[]> rows = store.query(select, mapper);
        long matched = writeBatched(store, update, batchSize, rows);
        result.rowCount(name, matched);
        long unmatched = rows.size() - matched;
        if (unmatched > 0) {
            warn(result, String.format("%s backfill: %d of %d row(s) matched no distribution",
                name, unmatched, rows.size()));
        }
    }
}
