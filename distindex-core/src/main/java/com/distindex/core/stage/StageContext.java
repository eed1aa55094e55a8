package com.distindex.core.stage;

import com.distindex.core.config.PipelineSettings;
import com.distindex.core.extract.ExtractSet;
import com.distindex.core.store.IndexStore;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Context provided to stages during execution.
 *
 * @param store store the index is built in
 * @param extracts source extracts
 * @param settings runtime settings
 * @param previousResults results of stages that already ran, keyed by stage id
 */
public record StageContext(
    IndexStore store,
    ExtractSet extracts,
    PipelineSettings settings,
    Map<String, StageResult> previousResults
) {
    /**
     * Compact constructor with validation.
     */
    public StageContext {
        Objects.requireNonNull(store, "store must not be null");
        if (extracts == null) {
            extracts = new ExtractSet(null, null, null, null, null, null, null, null, null);
        }
        if (settings == null) {
            settings = PipelineSettings.defaults();
        }
        previousResults = previousResults == null ? Map.of() : Map.copyOf(previousResults);
    }

    /**
     * Returns a context that also carries {@code result}.
     *
     * @param result result of the stage that just ran
     * @return new context
     */
    public StageContext withResult(StageResult result) {
        Map<String, StageResult> results = new LinkedHashMap<>(previousResults);
        results.put(result.stageId(), result);
        return new StageContext(store, extracts, settings, results);
    }
}
