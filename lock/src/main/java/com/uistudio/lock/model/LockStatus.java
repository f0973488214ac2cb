/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.uistudio.lock.model;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Point-in-time view of a resource's lock as seen by one context.
 * A stale record is reported as unlocked whatever owner it still names.
 */
public record LockStatus(
        boolean locked,
        boolean ownedBySelf,
        Optional<String> holderId,
        Optional<Duration> leaseAge
) {
    private static final LockStatus UNLOCKED =
            new LockStatus(false, false, Optional.empty(), Optional.empty());

    public LockStatus {
        Objects.requireNonNull(holderId, "holderId optional must not be null");
        Objects.requireNonNull(leaseAge, "leaseAge optional must not be null");
        if (ownedBySelf && !locked) {
            throw new IllegalArgumentException("an unlocked resource cannot be owned");
        }
    }

    public static LockStatus unlocked() {
        return UNLOCKED;
    }

    public static LockStatus heldBy(String holderId, boolean ownedBySelf, Duration leaseAge) {
        return new LockStatus(true, ownedBySelf, Optional.of(holderId), Optional.of(leaseAge));
    }

    /**
     * Checks if another context currently holds a live lease.
     */
    public boolean isHeldByOther() {
        return locked && !ownedBySelf;
    }
}
