package com.distindex.core;

import com.distindex.core.model.CoverageReport;
import com.distindex.core.stage.StageResult;
import com.distindex.core.stage.impl.IndexingStage;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a completed generation run.
 *
 * @param location store location, a file path or {@code :memory:}
 * @param stages stage results in execution order
 * @param coverage secondary source coverage of the distribution table
 * @param elapsed total wall-clock time
 */
public record GenerationReport(
    String location,
    List<StageResult> stages,
    CoverageReport coverage,
    Duration elapsed
) {
    /**
     * Compact constructor with validation.
     */
    public GenerationReport {
        Objects.requireNonNull(location, "location must not be null");
        stages = stages == null ? List.of() : List.copyOf(stages);
        if (coverage == null) {
            coverage = CoverageReport.empty();
        }
        if (elapsed == null) {
            elapsed = Duration.ZERO;
        }
    }

    /**
     * Assembles a report, reading coverage from the indexing stage's result.
     *
     * @param location store location
     * @param stages stage results in execution order
     * @param elapsed total wall-clock time
     * @return report
     */
    static GenerationReport of(String location, List<StageResult> stages, Duration elapsed) {
        CoverageReport coverage = stages.stream()
            .filter(result -> IndexingStage.STAGE_ID.equals(result.stageId()))
            .findFirst()
            .map(result -> new CoverageReport(
                result.rowCount(IndexingStage.COVERAGE_DISTRIBUTIONS),
                result.rowCount(IndexingStage.COVERAGE_UPLOADED),
                result.rowCount(IndexingStage.COVERAGE_META),
                result.rowCount(IndexingStage.COVERAGE_RATING),
                result.rowCount(IndexingStage.COVERAGE_TESTED)))
            .orElse(CoverageReport.empty());
        return new GenerationReport(location, stages, coverage, elapsed);
    }

    /**
     * Returns the result of one stage.
     *
     * @param stageId stage ID
     * @return result, or empty if the stage did not run
     */
    public Optional<StageResult> stage(String stageId) {
        return stages.stream().filter(result -> result.stageId().equals(stageId)).findFirst();
    }

    /**
     * Returns every warning of every stage, prefixed with the stage ID.
     *
     * @return warnings in execution order
     */
    public List<String> warnings() {
        return stages.stream()
            .flatMap(result -> result.warnings().stream().map(warning -> result.stageId() + ": " + warning))
            .toList();
    }

    public boolean hasWarnings() {
        return stages.stream().anyMatch(StageResult::hasWarnings);
    }
}
