package com.distindex.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FileUtils}.
 */
class FileUtilsTest {

    @TempDir
    Path tempDir;

    @Test
    void prepareTarget_withMissingParent_createsDirectories() throws IOException {
        Path target = tempDir.resolve("out/nested/index.db");

        FileUtils.prepareTarget(target);

        assertThat(target.getParent()).isDirectory();
        assertThat(target).doesNotExist();
    }

    @Test
    void prepareTarget_withExistingFile_removesIt() throws IOException {
        Path target = tempDir.resolve("index.db");
        Files.writeString(target, "stale");

        FileUtils.prepareTarget(target);

        assertThat(target).doesNotExist();
    }

    @Test
    void isReadableFile_checksRegularFiles() throws IOException {
        Path file = Files.writeString(tempDir.resolve("extract.db"), "x");

        assertThat(FileUtils.isReadableFile(file)).isTrue();
        assertThat(FileUtils.isReadableFile(tempDir)).isFalse();
        assertThat(FileUtils.isReadableFile(tempDir.resolve("missing.db"))).isFalse();
        assertThat(FileUtils.isReadableFile(null)).isFalse();
    }

    @Test
    void age_withOldFile_returnsElapsedTime() throws IOException {
        Path file = Files.writeString(tempDir.resolve("extract.db"), "x");
        Instant modified = Instant.parse("2020-01-01T00:00:00Z");
        Files.setLastModifiedTime(file, FileTime.from(modified));

        assertThat(FileUtils.age(file, modified.plus(Duration.ofHours(5))))
            .contains(Duration.ofHours(5));
    }

    @Test
    void age_withFutureTimestamp_returnsZero() throws IOException {
        Path file = Files.writeString(tempDir.resolve("extract.db"), "x");
        Instant modified = Instant.parse("2030-01-01T00:00:00Z");
        Files.setLastModifiedTime(file, FileTime.from(modified));

        assertThat(FileUtils.age(file, Instant.parse("2029-01-01T00:00:00Z"))).contains(Duration.ZERO);
    }

    @Test
    void age_withMissingFile_returnsEmpty() {
        assertThat(FileUtils.age(tempDir.resolve("missing.db"), Instant.now())).isEmpty();
    }
}
