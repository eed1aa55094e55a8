package com.distindex.core.graph;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class UmbrellaFilterTest {

    @Test
    void isUmbrella_matchesPrefixIgnoringCase() {
        UmbrellaFilter filter = new UmbrellaFilter(List.of("Task-", "Acme"));

        assertThat(filter.isUmbrella("Task-Kensho")).isTrue();
        assertThat(filter.isUmbrella("task-lower")).isTrue();
        assertThat(filter.isUmbrella("ACME-Everything")).isTrue();
        assertThat(filter.isUmbrella("Taskmaster")).isFalse();
        assertThat(filter.isUmbrella("Moose")).isFalse();
        assertThat(filter.isUmbrella(null)).isFalse();
    }

    @Test
    void constructor_withBlankPrefixes_ignoresThem() {
        // Given: an empty prefix would otherwise match everything
        UmbrellaFilter filter = new UmbrellaFilter(Arrays.asList("", null, "Task-"));

        assertThat(filter.prefixes()).containsExactly("task-");
        assertThat(filter.test("Moose")).isFalse();
    }

    @Test
    void none_matchesNothing() {
        assertThat(UmbrellaFilter.none().test("Task-Anything")).isFalse();
    }
}
