package com.distindex.core.model;

import java.util.Objects;

/**
 * An open bug-tracker ticket against a distribution.
 *
 * @param id tracker ticket id
 * @param distribution distribution the ticket is filed against
 * @param subject ticket subject
 * @param status tracker status (never resolved or rejected)
 * @param severity severity, {@code normal} when the tracker had none
 * @param created creation date ({@code YYYY-MM-DD})
 * @param updated last update date ({@code YYYY-MM-DD})
 */
public record Ticket(
    long id,
    String distribution,
    String subject,
    String status,
    String severity,
    String created,
    String updated
) {
    /**
     * Compact constructor with validation.
     */
    public Ticket {
        Objects.requireNonNull(distribution, "distribution must not be null");
        Objects.requireNonNull(status, "status must not be null");
        if (severity == null) {
            severity = "normal";
        }
    }
}
