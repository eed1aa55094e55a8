package com.distindex.core.stage.impl;

import com.distindex.core.ExtractFixtures;
import com.distindex.core.extract.ExtractSet;
import com.distindex.core.model.DependencyEdge;
import com.distindex.core.model.RequiresEdge;
import com.distindex.core.stage.StageResult;
import com.distindex.core.stage.StageTestBase;
import com.distindex.core.store.IndexQueries;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link DependencyResolver}.
 */
class DependencyResolverTest extends StageTestBase {

    private static ExtractFixtures fooAndBarWithUtil() {
        return ExtractFixtures.create()
            .distribution("FOO", "Foo", "1.0")
            .distribution("BAR", "Bar", "2.0")
            .module("Bar::Util", "2.0", "Bar");
    }

    @Test
    void run_moduleDeclaration_becomesDistributionEdge() {
        // Given
        ExtractSet extracts = ExtractFixtures.fooRequiresBar().build();

        // When
        StageResult result = runThroughResolve(extracts);

        // Then
        assertThat(result.rowCount("dependency")).isEqualTo(1);
        assertThat(new IndexQueries(store).dependencies("Foo"))
            .containsExactly(new DependencyEdge("Foo", "Bar", "runtime", null));
    }

    @Test
    void run_competingDeclarations_keepHighestCore() {
        // Given: two modules of Bar required by Foo in the same phase
        ExtractSet extracts = fooAndBarWithUtil()
            .requires("FOO", "Foo", "1.0", "Bar", "1.0", "runtime", "5.006")
            .requires("FOO", "Foo", "1.0", "Bar::Util", "1.0", "runtime", "5.008")
            .build();

        // When
        runThroughResolve(extracts);

        // Then
        List<DependencyEdge> edges = new IndexQueries(store).dependencies("Foo");
        assertThat(edges).hasSize(1);
        assertThat(edges.get(0).core()).isEqualTo(5.008);
    }

    @Test
    void run_nullCoreCompetingWithValue_keepsValue() {
        // Given
        ExtractSet extracts = fooAndBarWithUtil()
            .requires("FOO", "Foo", "1.0", "Bar", "1.0", "runtime", null)
            .requires("FOO", "Foo", "1.0", "Bar::Util", "1.0", "runtime", "5.006")
            .build();

        // When
        runThroughResolve(extracts);

        // Then
        assertThat(new IndexQueries(store).dependencies("Foo"))
            .extracting(DependencyEdge::core)
            .containsExactly(5.006);
    }

    @Test
    void run_differentPhases_keepSeparateEdges() {
        // Given
        ExtractSet extracts = fooAndBarWithUtil()
            .requires("FOO", "Foo", "1.0", "Bar", "1.0", "runtime", null)
            .requires("FOO", "Foo", "1.0", "Bar::Util", "1.0", "build", null)
            .build();

        // When
        StageResult result = runThroughResolve(extracts);

        // Then
        assertThat(result.rowCount("dependency")).isEqualTo(2);
        assertThat(new IndexQueries(store).dependencies("Foo"))
            .extracting(DependencyEdge::phase)
            .containsExactly("build", "runtime");
    }

    @Test
    void run_unknownModule_producesRequiresButNoEdge() {
        // Given: "strict" is provided by no indexed distribution
        ExtractSet extracts = ExtractFixtures.fooRequiresBar()
            .requires("FOO", "Foo", "1.0", "strict", "0", "runtime", "5")
            .build();

        // When
        StageResult result = runThroughResolve(extracts);

        // Then
        assertThat(result.rowCount("dependency")).isEqualTo(1);
        assertThat(result.rowCount("requires")).isEqualTo(2);
        assertThat(new IndexQueries(store).requires("Foo"))
            .extracting(RequiresEdge::module)
            .containsExactly("Bar", "strict");
    }

    @Test
    void run_duplicateRequires_keepHighestCoreThenSmallestVersion() {
        // Given
        ExtractSet extracts = ExtractFixtures.fooRequiresBar()
            .requires("FOO", "Foo", "1.0", "Baz", "2.0", "test", "5.008")
            .requires("FOO", "Foo", "1.0", "Baz", "1.0", "test", "5.006")
            .requires("FOO", "Foo", "1.0", "Qux", "0.9", "test", null)
            .requires("FOO", "Foo", "1.0", "Qux", "0.5", "test", null)
            .build();

        // When
        runThroughResolve(extracts);

        // Then
        assertThat(string("SELECT version FROM requires WHERE module = 'Baz'")).isEqualTo("2.0");
        assertThat(string("SELECT version FROM requires WHERE module = 'Qux'")).isEqualTo("0.5");
        assertThat(count("SELECT COUNT(*) FROM requires WHERE distribution = 'Foo'")).isEqualTo(3);
    }

    @Test
    void run_selfDependency_isKept() {
        // Given
        ExtractSet extracts = ExtractFixtures.create()
            .distribution("FOO", "Foo", "1.0")
            .requires("FOO", "Foo", "1.0", "Foo", "1.0", "test", null)
            .build();

        // When
        runThroughResolve(extracts);

        // Then
        assertThat(new IndexQueries(store).dependencies("Foo"))
            .singleElement()
            .satisfies(edge -> assertThat(edge.isSelfEdge()).isTrue());
    }
}
