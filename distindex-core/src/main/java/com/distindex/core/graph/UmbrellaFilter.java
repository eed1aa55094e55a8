package com.distindex.core.graph;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Recognizes umbrella distributions by name prefix.
 *
 * <p>Umbrella distributions (task bundles, joke namespaces) declare many
 * dependencies without being real dependents; counting them would inflate the
 * weight of everything they bundle. Prefixes are matched case-insensitively.
 */
public final class UmbrellaFilter implements Predicate<String> {

    private final List<String> prefixes;

    /**
     * Creates a filter for the given prefixes.
     *
     * @param prefixes name prefixes, e.g. {@code "Task-"}
     */
    public UmbrellaFilter(List<String> prefixes) {
        Objects.requireNonNull(prefixes, "prefixes must not be null");
        this.prefixes = prefixes.stream()
            .filter(prefix -> prefix != null && !prefix.isEmpty())
            .map(prefix -> prefix.toLowerCase(Locale.ROOT))
            .toList();
    }

    /**
     * Creates a filter that matches nothing.
     *
     * @return empty filter
     */
    public static UmbrellaFilter none() {
        return new UmbrellaFilter(List.of());
    }

    public boolean isUmbrella(String distribution) {
        if (distribution == null) {
            return false;
        }
        String name = distribution.toLowerCase(Locale.ROOT);
        for (String prefix : prefixes) {
            if (name.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean test(String distribution) {
        return isUmbrella(distribution);
    }

    public List<String> prefixes() {
        return prefixes;
    }
}
