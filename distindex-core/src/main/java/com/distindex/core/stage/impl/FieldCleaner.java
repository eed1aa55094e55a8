package com.distindex.core.stage.impl;

import com.distindex.core.stage.StageContext;
import com.distindex.core.stage.StageResult;
import com.distindex.core.stage.base.AbstractStage;
import com.distindex.core.store.BatchWriter;
import com.distindex.core.store.IndexStore;
import com.distindex.core.util.VersionCleaner;

import java.util.List;

/**
 * Repairs the version and core columns of the staged dependency declarations.
 *
 * <p>Runs in two passes over {@code t_requires}:
 * <ol>
 *   <li>Every distinct comparator- or {@code v}-prefixed value is rewritten with
 *       {@link VersionCleaner#clean(String)}. The rewrite is applied per distinct
 *       value, so each dirty token costs one keyed update.</li>
 *   <li>Null-defaulting: an empty version becomes {@code 0} together with its core;
 *       a null version becomes {@code 0}, and its core too when that is null or
 *       empty; any remaining empty core becomes {@code 0}.</li>
 * </ol>
 *
 * <p>Afterwards no version or core in {@code t_requires} is an empty string.
 */
public class FieldCleaner extends AbstractStage {

    public static final String STAGE_ID = "clean-fields";
    private static final String STAGE_DISPLAY_NAME = "Clean dependency fields";

    private static final String[] CLEANED_COLUMNS = {"version", "core"};

    private static final String DEFAULT_EMPTY_VERSION =
        "UPDATE t_requires SET version = '0', core = '0' WHERE version = ''";
    private static final String DEFAULT_NULL_VERSION =
        "UPDATE t_requires SET version = '0', "
            + "core = CASE WHEN core IS NULL OR core = '' THEN '0' ELSE core END "
            + "WHERE version IS NULL";
    private static final String DEFAULT_EMPTY_CORE =
        "UPDATE t_requires SET core = '0' WHERE core = ''";

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

        log.info("Cleaning table t_requires...");
        for (String column : CLEANED_COLUMNS) {
            long rewritten = rewrite(store, column, batchSize);
            result.rowCount(column, rewritten);
            log.debug("Rewrote {} {} value(s)", rewritten, column);
        }

        long emptyVersions = store.update(DEFAULT_EMPTY_VERSION);
        long nullVersions = store.update(DEFAULT_NULL_VERSION);
        long emptyCores = store.update(DEFAULT_EMPTY_CORE);
        result.rowCount("defaulted", emptyVersions + nullVersions + emptyCores);
        log.debug("Defaulted {} empty version(s), {} null version(s), {} empty core(s)",
            emptyVersions, nullVersions, emptyCores);
    }

    private long rewrite(IndexStore store, String column, int batchSize) {
        List<String> dirty = store.query(
            "SELECT DISTINCT " + column + " FROM t_requires WHERE " + column + " GLOB ?",
            rs -> rs.getString(1),
            VersionCleaner.DIRTY_GLOB
        );
        try (BatchWriter writer = store.batchWriter(
                "UPDATE t_requires SET " + column + " = ? WHERE " + column + " = ?", batchSize)) {
            dirty.stream()
                .filter(VersionCleaner::needsCleaning)
                .forEach(value -> writer.add(VersionCleaner.clean(value), value));
            writer.flush();
            return writer.rowsAffected();
        }
    }
}
