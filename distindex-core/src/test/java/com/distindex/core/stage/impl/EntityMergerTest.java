package com.distindex.core.stage.impl;

import com.distindex.core.ExtractFixtures;
import com.distindex.core.extract.ExtractSet;
import com.distindex.core.model.Distribution;
import com.distindex.core.stage.StageResult;
import com.distindex.core.stage.StageTestBase;
import com.distindex.core.store.IndexQueries;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link EntityMerger}.
 */
class EntityMergerTest extends StageTestBase {

    private StageResult merge(ExtractSet extracts) {
        return runAll(extracts, new Normalizer(), new FieldCleaner(), new EntityMerger());
    }

    @Test
    void run_releaseWithoutSecondaryData_stillProducesDistribution() {
        // Given: Foo has an upload and tester data, Bar has neither
        ExtractSet extracts = ExtractFixtures.fooRequiresBar()
            .upload("FOO", "Foo", "1.0", 1230768000L)
            .tester("Foo", "1.0", 10, 1, 2, 3)
            .build();

        // When
        StageResult result = merge(extracts);

        // Then
        assertThat(result.rowCount("distribution")).isEqualTo(2);
        Distribution foo = new IndexQueries(store).distribution("Foo").orElseThrow();
        assertThat(foo.uploaded()).isEqualTo("2009-01-01");
        assertThat(foo.pass()).isEqualTo(10);
        assertThat(foo.fail()).isEqualTo(1);
        assertThat(foo.na()).isEqualTo(2);
        assertThat(foo.unknown()).isEqualTo(3);

        Distribution bar = new IndexQueries(store).distribution("Bar").orElseThrow();
        assertThat(bar.uploaded()).isNull();
        assertThat(bar.hasTestResults()).isFalse();
        assertThat(bar.meta()).isFalse();
        assertThat(bar.ratings()).isZero();
        assertThat(bar.weight()).isZero();
        assertThat(bar.volatility()).isZero();
    }

    @Test
    void run_duplicateDistributionName_firstReleaseWins() {
        // Given
        ExtractSet extracts = ExtractFixtures.create()
            .distribution("FOO", "Foo", "1.0")
            .release("FOO", "Foo", "0.9")
            .build();

        // When
        StageResult result = merge(extracts);

        // Then
        assertThat(result.rowCount("distribution")).isEqualTo(1);
        assertThat(string("SELECT version FROM distribution WHERE distribution = 'Foo'")).isEqualTo("1.0");
    }

    @Test
    void run_authors_areDeduplicatedAndNamed() {
        // Given
        ExtractSet extracts = ExtractFixtures.create()
            .author("FOO", "Foo Person")
            .author("FOO", "Someone Else")
            .author("NONAME", null)
            .release("FOO", "Foo", "1.0")
            .build();

        // When
        StageResult result = merge(extracts);

        // Then
        assertThat(result.rowCount("author")).isEqualTo(2);
        assertThat(new IndexQueries(store).author("FOO").orElseThrow().name()).isEqualTo("Foo Person");
        assertThat(new IndexQueries(store).author("NONAME").orElseThrow().name()).isEqualTo("NONAME");
    }

    @Test
    void run_releaseOfUnknownAuthor_isSkippedWithWarning() {
        // Given
        ExtractSet extracts = ExtractFixtures.create()
            .distribution("FOO", "Foo", "1.0")
            .release("GHOST", "Ghost", "1.0")
            .build();

        // When
        StageResult result = merge(extracts);

        // Then
        assertThat(result.rowCount("distribution")).isEqualTo(1);
        assertThat(result.warnings()).anySatisfy(w -> assertThat(w).contains("author not in package index"));
    }

    @Test
    void run_modules_onlyForKnownDistributions() {
        // Given
        ExtractSet extracts = ExtractFixtures.fooRequiresBar()
            .module("Orphan::Module", "1.0", "Orphan")
            .module("Foo::Extra", "0.5", "Foo")
            .build();

        // When
        StageResult result = merge(extracts);

        // Then
        assertThat(result.rowCount("module")).isEqualTo(3);
        assertThat(strings("SELECT module FROM module ORDER BY module"))
            .containsExactly("Bar", "Foo", "Foo::Extra");
    }

    @Test
    void run_ratingsBackfill_updatesMatchedAndWarnsAboutUnmatched() {
        // Given
        ExtractSet extracts = ExtractFixtures.fooRequiresBar()
            .rating("Foo", "4.5", 3)
            .rating("Nowhere", "1", 1)
            .build();

        // When
        StageResult result = merge(extracts);

        // Then
        Distribution foo = new IndexQueries(store).distribution("Foo").orElseThrow();
        assertThat(foo.rating()).isEqualTo("4.5");
        assertThat(foo.ratings()).isEqualTo(3);
        assertThat(result.rowCount("ratings")).isEqualTo(1);
        assertThat(result.warnings()).anySatisfy(w -> assertThat(w).contains("ratings backfill: 1 of 2"));
    }

    @Test
    void run_metaBackfill_matchesOnRelease() {
        // Given
        ExtractSet extracts = ExtractFixtures.fooRequiresBar()
            .meta(ExtractFixtures.releasePath("FOO", "Foo", "1.0"), true, "perl")
            .build();

        // When
        StageResult result = merge(extracts);

        // Then
        Distribution foo = new IndexQueries(store).distribution("Foo").orElseThrow();
        assertThat(foo.meta()).isTrue();
        assertThat(foo.license()).isEqualTo("perl");
        assertThat(result.rowCount("meta")).isEqualTo(1);
        assertThat(result.warnings()).noneSatisfy(w -> assertThat(w).contains("meta backfill"));
    }

    @Test
    void run_tickets_areCopiedFromStaging() {
        // Given
        ExtractSet extracts = ExtractFixtures.fooRequiresBar()
            .ticket(42, "Foo", "open", "critical")
            .ticket(43, "Foo", "resolved", "critical")
            .build();

        // When
        StageResult result = merge(extracts);

        // Then
        assertThat(result.rowCount("ticket")).isEqualTo(1);
        assertThat(new IndexQueries(store).tickets("Foo"))
            .singleElement()
            .satisfies(ticket -> {
                assertThat(ticket.id()).isEqualTo(42L);
                assertThat(ticket.severity()).isEqualTo("critical");
                assertThat(ticket.created()).isEqualTo("2009-01-02");
            });
    }
}
