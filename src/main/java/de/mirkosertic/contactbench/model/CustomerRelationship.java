package de.mirkosertic.contactbench.model;

import java.time.Instant;

/**
 * Loyalty data of exactly one app user.
 */
public record CustomerRelationship(
        long id,
        long appUserId,
        long points,
        Instant created,
        Instant lastActivity
) {
}
