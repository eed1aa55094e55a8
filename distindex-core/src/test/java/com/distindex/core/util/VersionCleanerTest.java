package com.distindex.core.util;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link VersionCleaner}.
 */
class VersionCleanerTest {

    @ParameterizedTest
    @CsvSource({
        "'>= 1.2', 1.2",
        "'v5.8.1', 5.8.1",
        "'>=1.02_01', 1.02_01",
        "'!= 0.3', 0.3",
        "'V1', 1",
        "'1.05', 1.05"
    })
    void clean_stripsComparatorsAndPrefixes(String raw, String expected) {
        assertThat(VersionCleaner.clean(raw)).isEqualTo(expected);
    }

    @Test
    void clean_withNull_returnsNull() {
        assertThat(VersionCleaner.clean(null)).isNull();
    }

    @Test
    void clean_onlyComparators_returnsEmptyString() {
        assertThat(VersionCleaner.clean(">= ")).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(strings = {">= 1.2", "v5.8.1", "~> 2", "== 3", "<0.9_01", "1.0 beta"})
    void clean_isIdempotent(String raw) {
        String once = VersionCleaner.clean(raw);

        assertThat(VersionCleaner.clean(once)).isEqualTo(once);
    }

    @ParameterizedTest
    @ValueSource(strings = {">= 1.2", "<2", "=1", "!0", "~1", "v5.8.1", "V1"})
    void needsCleaning_withPrefix_returnsTrue(String raw) {
        assertThat(VersionCleaner.needsCleaning(raw)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"1.2", "0", "", "1.0 beta"})
    void needsCleaning_withoutPrefix_returnsFalse(String raw) {
        assertThat(VersionCleaner.needsCleaning(raw)).isFalse();
    }

    @Test
    void needsCleaning_withNull_returnsFalse() {
        assertThat(VersionCleaner.needsCleaning(null)).isFalse();
    }
}
