package com.distindex.core.util;

import java.util.regex.Pattern;

/**
 * Repairs malformed version strings found in dependency declarations.
 *
 * <p>Declarations frequently carry comparator prefixes ({@code ">= 1.2"}) or
 * {@code v}-prefixed versions ({@code "v5.8.1"}). Cleaning strips every character
 * that is not a digit, period or underscore, leaving a bare token that can be
 * stored and compared:
 *
 * <pre>{@code
 * VersionCleaner.clean(">= 1.02_01");  // "1.02_01"
 * VersionCleaner.clean("v5.8.1");      // "5.8.1"
 * VersionCleaner.clean(null);          // null
 * }</pre>
 *
 * <p>The rewrite is idempotent: {@code clean(clean(x)).equals(clean(x))}.
 */
public final class VersionCleaner {

    private static final Pattern NON_VERSION_CHARS = Pattern.compile("[^0-9._]");

    /**
     * SQLite GLOB selecting the values {@link #needsCleaning(String)} accepts.
     */
    public static final String DIRTY_GLOB = "[<>=!~vV]*";

    private VersionCleaner() {
        // Utility class
    }

    /**
     * Strips everything except digits, periods and underscores.
     *
     * @param version raw version, may be null
     * @return bare version token, or null for null input
     */
    public static String clean(String version) {
        if (version == null) {
            return null;
        }
        return NON_VERSION_CHARS.matcher(version).replaceAll("");
    }

    /**
     * Checks whether a value carries a comparator or {@code v} prefix.
     *
     * @param version raw version, may be null
     * @return true if the value should be rewritten by {@link #clean(String)}
     */
    public static boolean needsCleaning(String version) {
        if (version == null || version.isEmpty()) {
            return false;
        }
        char first = version.charAt(0);
        return first == '<' || first == '>' || first == '=' || first == '!'
            || first == '~' || first == 'v' || first == 'V';
    }
}
