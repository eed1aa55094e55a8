package com.distindex.core.extract;

import com.distindex.core.util.FileUtils;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Reports how old an extract's data is.
 *
 * <p>Not every source can tell; those use {@link #unknown()}. The capability is
 * chosen when the extract is constructed.
 */
@FunctionalInterface
public interface Freshness {

    /**
     * Returns the age of the extract's data.
     *
     * @return age, or empty if the source cannot report it
     */
    Optional<Duration> age();

    /**
     * Returns a freshness that never reports an age.
     *
     * @return no-op freshness
     */
    static Freshness unknown() {
        return Optional::empty;
    }

    /**
     * Returns a freshness based on a file's modification time.
     *
     * @param file backing file
     * @param clock clock used as "now"
     * @return file-based freshness
     */
    static Freshness ofFile(Path file, Clock clock) {
        return () -> FileUtils.age(file, clock.instant());
    }

    /**
     * Describes the age for log output, e.g. {@code "3 day(s)"}.
     *
     * @return human-readable age, or {@code "Not Implemented"}
     */
    default String describe() {
        return age()
            .map(age -> age.toDays() + " day(s)")
            .orElse("Not Implemented");
    }
}
