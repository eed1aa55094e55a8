package com.distindex.core.stage;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result returned by a stage after execution.
 *
 * @param stageId ID of the stage that produced this result
 * @param rowCounts rows produced or updated, keyed by table or pass name
 * @param warnings degraded conditions the run tolerated
 * @param elapsed wall-clock time spent in the stage
 */
public record StageResult(
    String stageId,
    Map<String, Long> rowCounts,
    List<String> warnings,
    Duration elapsed
) {
    /**
     * Compact constructor with validation.
     */
    public StageResult {
        Objects.requireNonNull(stageId, "stageId must not be null");
        rowCounts = rowCounts == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(rowCounts));
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        if (elapsed == null) {
            elapsed = Duration.ZERO;
        }
    }

    /**
     * Returns true if the stage tolerated any degraded condition.
     *
     * @return true if warnings were recorded
     */
    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    /**
     * Returns the recorded count for a table or pass.
     *
     * @param key table or pass name
     * @return count, or 0 if none was recorded
     */
    public long rowCount(String key) {
        return rowCounts.getOrDefault(key, 0L);
    }

    /**
     * Creates a builder for the given stage.
     *
     * @param stageId stage ID
     * @return new builder
     */
    public static Builder builder(String stageId) {
        return new Builder(stageId);
    }

    /**
     * Builder for constructing results incrementally.
     */
    public static class Builder {
        private final String stageId;
        private final Map<String, Long> rowCounts = new LinkedHashMap<>();
        private final List<String> warnings = new ArrayList<>();
        private Duration elapsed = Duration.ZERO;

        private Builder(String stageId) {
            this.stageId = stageId;
        }

        public Builder rowCount(String key, long count) {
            rowCounts.put(key, count);
            return this;
        }

        public Builder warning(String message) {
            warnings.add(message);
            return this;
        }

        public Builder elapsed(Duration duration) {
            this.elapsed = duration;
            return this;
        }

        public StageResult build() {
            return new StageResult(stageId, rowCounts, warnings, elapsed);
        }
    }
}
