package com.distindex.core.stage.impl;

import com.distindex.core.extract.Extract;
import com.distindex.core.extract.ExtractSet;
import com.distindex.core.stage.StageContext;
import com.distindex.core.stage.StageResult;
import com.distindex.core.stage.base.AbstractStage;
import com.distindex.core.store.BatchWriter;
import com.distindex.core.store.IndexStore;

import java.util.function.Function;

/**
 * Loads every source extract into a staging table keyed for the later joins.
 *
 * <p>The extracts use different keys and granularities. This stage brings them
 * to two shared join keys:
 * <ul>
 *   <li>{@code dist_version}: distribution name and version separated by a space</li>
 *   <li>{@code release}: author ID and archive file name separated by a slash</li>
 * </ul>
 *
 * <p>Uploads are reduced to one row per release (shortest distribution name
 * first), tester summaries to one row per {@code dist_version}, and tickets to
 * open tickets of known distributions with a default severity of {@code normal}.
 * Dependency declarations are attached to the distribution owning their release.
 *
 * <p>The package index extracts and the dependency declarations are required;
 * the run fails without them. Every other extract is optional: when it is not
 * available its staging table is left empty and a warning is recorded.
 *
 * @see ExtractSet
 */
public class Normalizer extends AbstractStage {

    public static final String STAGE_ID = "normalize";
    private static final String STAGE_DISPLAY_NAME = "Normalize extracts";

    private static final String INSERT_AUTHOR =
        "INSERT INTO t_author (author, name) VALUES (?, ?)";
    private static final String INSERT_DISTRIBUTION =
        "INSERT INTO t_distribution (dist, version, dist_version, author, release) VALUES (?, ?, ?, ?, ?)";
    private static final String INSERT_MODULE =
        "INSERT INTO t_module (module, version, dist) VALUES (?, ?, ?)";
    private static final String INSERT_REQUIRES =
        "INSERT INTO t_raw_requires (release, module, version, phase, core) VALUES (?, ?, ?, ?, ?)";
    private static final String INSERT_UPLOAD =
        "INSERT INTO t_raw_uploads (dist, version, author, filename, released) VALUES (?, ?, ?, ?, ?)";
    private static final String INSERT_TESTERS =
        "INSERT INTO t_raw_testers (dist, version, pass, fail, na, unknown) VALUES (?, ?, ?, ?, ?, ?)";
    private static final String INSERT_RATING =
        "INSERT INTO t_rating (distribution, rating, ratings) VALUES (?, ?, ?)";
    private static final String INSERT_META =
        "INSERT INTO t_meta (release, meta, license) VALUES (?, ?, ?)";
    private static final String INSERT_TICKET =
        "INSERT INTO t_raw_tickets (id, distribution, subject, status, severity, created, updated) "
            + "VALUES (?, ?, ?, ?, ?, ?, ?)";

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
        ExtractSet extracts = context.extracts();
        IndexStore store = context.store();
        int batchSize = context.settings().batchSize();

        for (Extract<?> extract : extracts.required()) {
            requireAvailable(extract);
        }
        for (Extract<?> extract : extracts.all()) {
            log.info("Extract {} age = {}", extract.name(), extract.freshness().describe());
        }

        store.executeScript("schema/staging.sql");

        log.info("Cleaning package index...");
        result.rowCount("t_author", load(store, extracts.authors(), INSERT_AUTHOR, batchSize,
            row -> new Object[]{row.author(), row.name()}));
        result.rowCount("t_distribution", load(store, extracts.releases(), INSERT_DISTRIBUTION, batchSize,
            row -> new Object[]{
                row.distribution(),
                row.version(),
                row.version() == null ? null : row.distribution() + " " + row.version(),
                row.author(),
                row.release()
            }));
        result.rowCount("t_module", load(store, extracts.modules(), INSERT_MODULE, batchSize,
            row -> new Object[]{row.module(), row.version(), row.distribution()}));

        log.info("Cleaning dependency declarations...");
        load(store, extracts.requires(), INSERT_REQUIRES, batchSize,
            row -> new Object[]{row.release(), row.module(), row.version(), row.phase(), row.core()});

        log.info("Cleaning secondary extracts...");
        loadOptional(store, result, extracts.uploads(), "t_uploaded", INSERT_UPLOAD, batchSize,
            row -> new Object[]{row.distribution(), row.version(), row.author(), row.filename(), row.released()});
        loadOptional(store, result, extracts.testers(), "t_testers", INSERT_TESTERS, batchSize,
            row -> new Object[]{row.distribution(), row.version(), row.pass(), row.fail(), row.na(), row.unknown()});
        loadOptional(store, result, extracts.ratings(), "t_rating", INSERT_RATING, batchSize,
            row -> new Object[]{row.distribution(), row.rating(), row.reviewCount()});
        loadOptional(store, result, extracts.meta(), "t_meta", INSERT_META, batchSize,
            row -> new Object[]{row.release(), row.meta() ? 1 : 0, row.license()});
        loadOptional(store, result, extracts.tickets(), "t_ticket", INSERT_TICKET, batchSize,
            row -> new Object[]{
                row.id(),
                row.distribution(),
                row.subject(),
                row.status(),
                row.severity(),
                row.created(),
                row.updated()
            });

        store.inTransaction(() -> store.executeScript("normalize/project.sql"));

        for (String table : new String[]{"t_requires", "t_uploaded", "t_testers", "t_rating", "t_meta", "t_ticket"}) {
            result.rowCount(table, store.count(table));
        }
        log.debug("Staging complete: {} releases, {} declarations",
            store.count("t_distribution"), store.count("t_requires"));
    }

    private <R> void loadOptional(
            IndexStore store,
            StageResult.Builder result,
            Extract<R> extract,
            String table,
            String sql,
            int batchSize,
            Function<R, Object[]> params) {
        if (!extract.isAvailable()) {
            warn(result, "Extract '" + extract.name() + "' is not available; " + table + " is empty");
            return;
        }
        load(store, extract, sql, batchSize, params);
    }

    private <R> long load(IndexStore store, Extract<R> extract, String sql, int batchSize,
                          Function<R, Object[]> params) {
        try (BatchWriter writer = store.batchWriter(sql, batchSize)) {
            extract.read(row -> writer.add(params.apply(row)));
            log.debug("Staged {} rows from extract {}", writer.rowsWritten(), extract.name());
            return writer.rowsWritten();
        }
    }
}
