package com.distindex.core.config;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class PipelineSettingsTest {

    @Test
    void defaults_matchDocumentedValues() {
        PipelineSettings settings = PipelineSettings.defaults();

        assertThat(settings.batchSize()).isEqualTo(100);
        assertThat(settings.cacheSize()).isEqualTo(100_000);
        assertThat(settings.excludedPrefixes()).containsExactly("Task-", "Acme-");
        assertThat(settings.keepStagingTables()).isFalse();
        assertThat(settings.vacuum()).isTrue();
        assertThat(settings.analyze()).isTrue();
    }

    @Test
    void constructor_nonPositiveBatchSize_throwsException() {
        assertThatThrownBy(() -> PipelineSettings.defaults().withBatchSize(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("batchSize");
    }

    @Test
    void constructor_nonPositiveCacheSize_throwsException() {
        assertThatThrownBy(() -> new PipelineSettings(10, -1, List.of(), false, false, false))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("cacheSize");
    }

    @Test
    void constructor_copiesPrefixes() {
        List<String> prefixes = new ArrayList<>(List.of("Task-"));

        PipelineSettings settings = new PipelineSettings(10, 10, prefixes, false, false, false);
        prefixes.add("Acme-");

        assertThat(settings.excludedPrefixes()).containsExactly("Task-");
        assertThat(new PipelineSettings(10, 10, null, false, false, false).excludedPrefixes()).isEmpty();
    }

    @Test
    void settings_invalidConfiguredValue_isRejected() {
        IndexConfig config = new IndexConfig(new IndexConfig.StoreConfig(null, -5, null), null, null, null);

        assertThatThrownBy(config::settings).isInstanceOf(IllegalArgumentException.class);
    }
}
