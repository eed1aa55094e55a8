package com.distindex.core.extract;

import com.distindex.core.config.IndexConfig.ExtractsConfig;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

/**
 * The full set of source extracts consumed by one generation run.
 *
 * <p>Null components are replaced by {@link Extract#missing(String)}, so every
 * accessor returns a usable extract; check {@link Extract#isAvailable()} to see
 * whether it has data.
 *
 * @param authors package index authors (required)
 * @param releases package index releases (required)
 * @param modules package index modules (required)
 * @param requires dependency declarations (required)
 * @param uploads upload timestamps (optional)
 * @param testers tester summaries (optional)
 * @param ratings community ratings (optional)
 * @param meta package-metadata flags (optional)
 * @param tickets bug tracker tickets (optional)
 */
public record ExtractSet(
    Extract<AuthorRow> authors,
    Extract<ReleaseRow> releases,
    Extract<ModuleRow> modules,
    Extract<RequiresRow> requires,
    Extract<UploadRow> uploads,
    Extract<TesterRow> testers,
    Extract<RatingRow> ratings,
    Extract<MetaRow> meta,
    Extract<TicketRow> tickets
) {
    /**
     * Compact constructor replacing null extracts with missing ones.
     */
    public ExtractSet {
        authors = orMissing(authors, "authors");
        releases = orMissing(releases, "releases");
        modules = orMissing(modules, "modules");
        requires = orMissing(requires, "requires");
        uploads = orMissing(uploads, "uploads");
        testers = orMissing(testers, "testers");
        ratings = orMissing(ratings, "ratings");
        meta = orMissing(meta, "meta");
        tickets = orMissing(tickets, "tickets");
    }

    /**
     * Builds the extract set from configured file locations.
     *
     * @param config extract locations
     * @param baseDir directory relative paths resolve against
     * @param clock clock used for freshness reporting
     * @return extract set; unconfigured sources are missing
     */
    public static ExtractSet fromConfig(ExtractsConfig config, Path baseDir, Clock clock) {
        Path index = resolve(baseDir, config.index());
        Path meta = resolve(baseDir, config.meta());
        Path uploads = resolve(baseDir, config.uploads());
        Path testers = resolve(baseDir, config.testers());
        Path rt = resolve(baseDir, config.rt());
        Path ratings = resolve(baseDir, config.ratings());

        return new ExtractSet(
            index == null ? null : SqliteExtracts.authors(index, clock),
            index == null ? null : SqliteExtracts.releases(index, clock),
            index == null ? null : SqliteExtracts.modules(index, clock),
            meta == null ? null : SqliteExtracts.requires(meta, clock),
            uploads == null ? null : SqliteExtracts.uploads(uploads, clock),
            testers == null ? null : SqliteExtracts.testers(testers, clock),
            ratings == null ? null : new CsvRatingsExtract(ratings, clock),
            meta == null ? null : SqliteExtracts.meta(meta, clock),
            rt == null ? null : SqliteExtracts.tickets(rt, clock)
        );
    }

    /**
     * Returns the extracts a run cannot proceed without.
     *
     * @return required extracts
     */
    public List<Extract<?>> required() {
        return List.of(authors, releases, modules, requires);
    }

    /**
     * Returns the extracts whose absence only degrades the index.
     *
     * @return optional extracts
     */
    public List<Extract<?>> optional() {
        return List.of(uploads, testers, ratings, meta, tickets);
    }

    /**
     * Returns every extract, required first.
     *
     * @return all extracts
     */
    public List<Extract<?>> all() {
        return List.of(authors, releases, modules, requires, uploads, testers, ratings, meta, tickets);
    }

    private static <R> Extract<R> orMissing(Extract<R> extract, String name) {
        return extract != null ? extract : Extract.missing(name);
    }

    private static Path resolve(Path baseDir, String location) {
        if (location == null || location.isBlank()) {
            return null;
        }
        Path path = Path.of(location);
        return path.isAbsolute() || baseDir == null ? path : baseDir.resolve(path);
    }
}
