package com.distindex.core.extract;

import com.distindex.core.config.IndexConfig.ExtractsConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.nio.file.attribute.FileTime;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ExtractSet}.
 */
class ExtractSetTest {

    @TempDir
    Path tempDir;

    @Test
    void constructor_nullExtracts_becomeMissing() {
        ExtractSet extracts = new ExtractSet(null, null, null, null, null, null, null, null, null);

        assertThat(extracts.all()).hasSize(9).noneMatch(Extract::isAvailable);
        assertThat(extracts.tickets().name()).isEqualTo("tickets");
        assertThat(extracts.required()).extracting(Extract::name)
            .containsExactly("authors", "releases", "modules", "requires");
        assertThat(extracts.optional()).extracting(Extract::name)
            .containsExactly("uploads", "testers", "ratings", "meta", "tickets");
    }

    @Test
    void fromConfig_resolvesRelativePathsAgainstBaseDir() throws IOException {
        Files.writeString(tempDir.resolve("cpandb.sql"), "");
        ExtractsConfig config = new ExtractsConfig("cpandb.sql", null, null, null, null, "ratings.csv");

        ExtractSet extracts = ExtractSet.fromConfig(config, tempDir, Clock.systemUTC());

        assertThat(extracts.authors()).isInstanceOf(SqliteExtract.class);
        assertThat(((SqliteExtract<?>) extracts.releases()).file()).isEqualTo(tempDir.resolve("cpandb.sql"));
        assertThat(extracts.authors().isAvailable()).isTrue();
        assertThat(extracts.requires().isAvailable()).isFalse();
        assertThat(extracts.ratings()).isInstanceOf(CsvRatingsExtract.class);
        assertThat(extracts.ratings().isAvailable()).isFalse();
    }

    @Test
    void freshness_fileExtract_reportsAgeInDays() throws IOException {
        Path file = Files.writeString(tempDir.resolve("cpandb.sql"), "");
        Instant modified = Instant.parse("2020-03-01T00:00:00Z");
        Files.setLastModifiedTime(file, FileTime.from(modified));
        Clock clock = Clock.fixed(modified.plus(Duration.ofDays(3)), ZoneOffset.UTC);

        ExtractSet extracts = ExtractSet.fromConfig(
            new ExtractsConfig(file.toString(), null, null, null, null, null), null, clock);

        assertThat(extracts.authors().freshness().describe()).isEqualTo("3 day(s)");
        assertThat(Extract.of("inline", List.of()).freshness().describe()).isEqualTo("Not Implemented");
    }
}
