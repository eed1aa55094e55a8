package com.distindex.core.extract;

import java.util.Objects;

/**
 * Community rating for a distribution, keyed by name only.
 *
 * @param distribution distribution name
 * @param rating average rating as published
 * @param reviewCount number of reviews
 */
public record RatingRow(String distribution, String rating, int reviewCount) {

    public RatingRow {
        Objects.requireNonNull(distribution, "distribution must not be null");
        if (reviewCount < 0) {
            throw new IllegalArgumentException("reviewCount must be >= 0");
        }
    }
}
