package com.distindex.core.extract;

import com.distindex.core.store.RowMapper;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Factory for the extracts read from the source SQLite databases.
 *
 * <p>Each source keeps its native schema:
 * <ul>
 *   <li>package index: {@code auths}, {@code dists}, {@code mods}</li>
 *   <li>metadata: {@code meta_dependency}, {@code meta_distribution}</li>
 *   <li>uploads: {@code uploads}</li>
 *   <li>testers: {@code release}</li>
 *   <li>bug tracker: {@code ticket}</li>
 * </ul>
 *
 * <p>Rows missing a key column map to null and are skipped by {@link SqliteExtract}.
 */
public final class SqliteExtracts {

    static final String AUTHORS = """
        SELECT cpanid, fullname
        FROM auths
        ORDER BY cpanid
        """;

    static final String RELEASES = """
        SELECT a.cpanid AS author, d.dist_name, d.dist_vers, d.dist_file
        FROM auths a
        JOIN dists d ON a.auth_id = d.auth_id
        ORDER BY d.dist_id
        """;

    static final String MODULES = """
        SELECT m.mod_name, m.mod_vers, d.dist_name
        FROM mods m
        JOIN dists d ON d.dist_id = m.dist_id
        ORDER BY m.mod_name
        """;

    static final String REQUIRES = """
        SELECT release, module, version, phase, core
        FROM meta_dependency
        """;

    static final String META = """
        SELECT release, meta, meta_license
        FROM meta_distribution
        """;

    static final String UPLOADS = """
        SELECT dist, version, author, filename, released
        FROM uploads
        """;

    static final String TESTERS = """
        SELECT dist, version, pass, fail, na, unknown
        FROM release
        """;

    static final String TICKETS = """
        SELECT id, distribution, subject, status, severity, created, updated
        FROM ticket
        """;

    private SqliteExtracts() {
        // Utility class
    }

    public static Extract<AuthorRow> authors(Path indexDb, Clock clock) {
        return new SqliteExtract<>("authors", indexDb, AUTHORS, rs -> {
            String author = rs.getString("cpanid");
            return author == null ? null : new AuthorRow(author, rs.getString("fullname"));
        }, clock);
    }

    public static Extract<ReleaseRow> releases(Path indexDb, Clock clock) {
        return new SqliteExtract<>("releases", indexDb, RELEASES, rs -> {
            String author = rs.getString("author");
            String distribution = rs.getString("dist_name");
            String file = rs.getString("dist_file");
            if (author == null || distribution == null || file == null) {
                return null;
            }
            return new ReleaseRow(author, distribution, rs.getString("dist_vers"), file);
        }, clock);
    }

    public static Extract<ModuleRow> modules(Path indexDb, Clock clock) {
        return new SqliteExtract<>("modules", indexDb, MODULES, rs -> {
            String module = rs.getString("mod_name");
            String distribution = rs.getString("dist_name");
            if (module == null || distribution == null) {
                return null;
            }
            return new ModuleRow(module, rs.getString("mod_vers"), distribution);
        }, clock);
    }

    public static Extract<RequiresRow> requires(Path metaDb, Clock clock) {
        return new SqliteExtract<>("requires", metaDb, REQUIRES, rs -> {
            String release = rs.getString("release");
            String module = rs.getString("module");
            if (release == null || module == null) {
                return null;
            }
            return new RequiresRow(release, module, rs.getString("version"), rs.getString("phase"),
                rs.getString("core"));
        }, clock);
    }

    public static Extract<MetaRow> meta(Path metaDb, Clock clock) {
        return new SqliteExtract<>("meta", metaDb, META, rs -> {
            String release = rs.getString("release");
            return release == null
                ? null
                : new MetaRow(release, rs.getInt("meta") != 0, rs.getString("meta_license"));
        }, clock);
    }

    public static Extract<UploadRow> uploads(Path uploadsDb, Clock clock) {
        return new SqliteExtract<>("uploads", uploadsDb, UPLOADS,
            rs -> new UploadRow(
                rs.getString("dist"),
                rs.getString("version"),
                rs.getString("author"),
                rs.getString("filename"),
                RowMapper.nullableLong(rs, "released")),
            clock);
    }

    public static Extract<TesterRow> testers(Path testersDb, Clock clock) {
        return new SqliteExtract<>("testers", testersDb, TESTERS, rs -> {
            String distribution = rs.getString("dist");
            if (distribution == null) {
                return null;
            }
            return new TesterRow(
                distribution,
                rs.getString("version"),
                RowMapper.nullableInt(rs, "pass"),
                RowMapper.nullableInt(rs, "fail"),
                RowMapper.nullableInt(rs, "na"),
                RowMapper.nullableInt(rs, "unknown"));
        }, clock);
    }

    public static Extract<TicketRow> tickets(Path rtDb, Clock clock) {
        return new SqliteExtract<>("tickets", rtDb, TICKETS, rs -> {
            Long id = RowMapper.nullableLong(rs, "id");
            if (id == null) {
                return null;
            }
            return new TicketRow(
                id,
                rs.getString("distribution"),
                rs.getString("subject"),
                rs.getString("status"),
                rs.getString("severity"),
                rs.getString("created"),
                rs.getString("updated"));
        }, clock);
    }
}
