package com.distindex.core.stage.impl;

import com.distindex.core.ExtractFixtures;
import com.distindex.core.config.PipelineSettings;
import com.distindex.core.extract.ExtractSet;
import com.distindex.core.model.CoverageReport;
import com.distindex.core.stage.StageContext;
import com.distindex.core.stage.StageResult;
import com.distindex.core.stage.StageTestBase;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link IndexingStage}.
 */
class IndexingStageTest extends StageTestBase {

    private ExtractSet extracts() {
        return ExtractFixtures.fooRequiresBar()
            .upload("FOO", "Foo", "1.0", 1230768000L)
            .rating("Bar", "5", 2)
            .build();
    }

    @Test
    void run_createsNamedIndexes() {
        // Given
        ExtractSet extracts = extracts();
        runThroughResolve(extracts);

        // When
        run(new IndexingStage(), extracts);

        // Then
        List<String> indexes = strings("SELECT name FROM sqlite_master WHERE type = 'index' AND name LIKE '%\\_\\_%' ESCAPE '\\'");
        assertThat(indexes).contains(
            "author__name",
            "distribution__release",
            "distribution__weight",
            "distribution__volatility",
            "module__distribution",
            "dependency__core",
            "requires__phase",
            "ticket__severity"
        );
        long expected = IndexingStage.INDEXES.values().stream().mapToLong(List::size).sum();
        assertThat(indexes).hasSize((int) expected);
    }

    @Test
    void run_reportsCoverage() {
        // Given
        ExtractSet extracts = extracts();
        runThroughResolve(extracts);

        // When
        StageResult result = run(new IndexingStage(), extracts);

        // Then
        assertThat(result.rowCount(IndexingStage.COVERAGE_DISTRIBUTIONS)).isEqualTo(2);
        assertThat(result.rowCount(IndexingStage.COVERAGE_UPLOADED)).isEqualTo(1);
        assertThat(result.rowCount(IndexingStage.COVERAGE_RATING)).isEqualTo(1);
        assertThat(result.rowCount(IndexingStage.COVERAGE_META)).isZero();
        CoverageReport coverage = IndexingStage.measureCoverage(store);
        assertThat(coverage.getFormattedCoverage("uploaded", coverage.uploaded())).isEqualTo("uploaded = 1/2 (50%)");
    }

    @Test
    void run_dropsStagingTablesByDefault() {
        // Given
        ExtractSet extracts = extracts();
        runThroughResolve(extracts);

        // When
        run(new IndexingStage(), extracts);

        // Then
        for (String table : IndexingStage.STAGING_TABLES) {
            assertThat(store.tableExists(table)).as(table).isFalse();
        }
        assertThat(store.tableExists("distribution")).isTrue();
    }

    @Test
    void run_keepStagingTables_leavesThemInPlace() {
        // Given
        ExtractSet extracts = extracts();
        runThroughResolve(extracts);
        PipelineSettings keep = settings().withKeepStagingTables(true);

        // When
        new IndexingStage().execute(new StageContext(store, extracts, keep, null));

        // Then
        assertThat(store.tableExists("t_requires")).isTrue();
        assertThat(store.tableExists("t_distribution")).isTrue();
    }
}
