/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.uistudio.lock.model;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * A lease on one resource as stored in the lock ledger.
 * Immutable record; renewal produces a new instance.
 *
 * <p>{@code renewedAt} is kept at millisecond precision so that a record survives a
 * round trip through any ledger unchanged.
 */
public record LockRecord(
        String resourceId,
        String ownerId,
        Instant renewedAt
) {
    public LockRecord {
        Objects.requireNonNull(resourceId, "resourceId must not be null");
        Objects.requireNonNull(ownerId, "ownerId must not be null");
        Objects.requireNonNull(renewedAt, "renewedAt must not be null");

        if (resourceId.isBlank()) {
            throw new IllegalArgumentException("resourceId must not be blank");
        }
        if (ownerId.isBlank()) {
            throw new IllegalArgumentException("ownerId must not be blank");
        }
        renewedAt = renewedAt.truncatedTo(ChronoUnit.MILLIS);
    }

    /**
     * Creates a fresh lease for the given owner.
     */
    public static LockRecord create(String resourceId, String ownerId, Instant now) {
        return new LockRecord(resourceId, ownerId, now);
    }

    /**
     * Returns a copy renewed at {@code now}. The new timestamp is always strictly later
     * than the current one, even when the clock has not advanced.
     */
    public LockRecord renewedBy(Instant now) {
        var candidate = now.truncatedTo(ChronoUnit.MILLIS);
        var next = candidate.isAfter(renewedAt) ? candidate : renewedAt.plusMillis(1);
        return new LockRecord(resourceId, ownerId, next);
    }

    /**
     * Checks if this record names the given context as owner.
     */
    public boolean isOwnedBy(String contextId) {
        return ownerId.equals(contextId);
    }

    /**
     * Validates a resource identifier supplied by a caller.
     */
    public static String requireResourceId(String resourceId) {
        if (resourceId == null || resourceId.isBlank()) {
            throw new IllegalArgumentException("resourceId must not be blank");
        }
        return resourceId;
    }
}
