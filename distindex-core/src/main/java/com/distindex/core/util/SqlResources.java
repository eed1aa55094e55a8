package com.distindex.core.util;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Loads SQL statements from classpath resources under {@code sql/}.
 *
 * <p>Set-based statements (staging projections, merges, DDL) are kept in
 * {@code .sql} files rather than Java string literals. A file may hold several
 * statements separated by semicolons; {@code --} line comments are dropped.
 */
public final class SqlResources {

    private static final String BASE_PATH = "sql/";
    private static final Map<String, String> CACHE = new ConcurrentHashMap<>();

    private SqlResources() {
        // Utility class
    }

    /**
     * Loads the raw text of a SQL resource.
     *
     * @param name resource name relative to {@code sql/}, e.g. {@code "schema/author.sql"}
     * @return file content
     * @throws IllegalArgumentException if the resource does not exist
     * @throws UncheckedIOException if the resource cannot be read
     */
    public static String load(String name) {
        return CACHE.computeIfAbsent(name, SqlResources::read);
    }

    /**
     * Loads a SQL resource and splits it into individual statements.
     *
     * @param name resource name relative to {@code sql/}
     * @return non-empty statements in file order
     */
    public static List<String> statements(String name) {
        String script = load(name).lines()
            .filter(line -> !line.trim().startsWith("--"))
            .collect(Collectors.joining("\n"));
        List<String> statements = new ArrayList<>();
        for (String chunk : script.split(";")) {
            String statement = chunk.trim();
            if (!statement.isEmpty()) {
                statements.add(statement);
            }
        }
        return statements;
    }

    private static String read(String name) {
        String path = BASE_PATH + name;
        try (InputStream in = SqlResources.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalArgumentException("SQL resource not found: " + path);
            }
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                return reader.lines().collect(Collectors.joining("\n"));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load SQL resource: " + path, e);
        }
    }
}
