package com.distindex.core.extract;

/**
 * A bug-tracker ticket as exported by the tracker.
 *
 * <p>Only the id is mandatory. Tickets without a known distribution or with a
 * null status are filtered out when staged.
 *
 * @param id ticket id
 * @param distribution queue (distribution) name, may be null
 * @param subject ticket subject
 * @param status tracker status, may be null
 * @param severity severity, may be null
 * @param created creation timestamp
 * @param updated last update timestamp
 */
public record TicketRow(
    long id,
    String distribution,
    String subject,
    String status,
    String severity,
    String created,
    String updated
) {}
