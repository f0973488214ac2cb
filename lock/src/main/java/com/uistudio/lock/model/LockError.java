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
 * Represents an error that occurred during a lock operation.
 */
public record LockError(
        LockErrorCode code,
        String message,
        Optional<String> currentHolderId,
        Optional<Duration> currentLeaseAge
) {
    public LockError {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(currentHolderId, "currentHolderId optional must not be null");
        Objects.requireNonNull(currentLeaseAge, "currentLeaseAge optional must not be null");
    }

    public LockError(LockErrorCode code, String message) {
        this(code, message, Optional.empty(), Optional.empty());
    }

    /**
     * Creates an error for a resource whose live lease belongs to another context.
     */
    public static LockError alreadyLocked(String holderId, Duration leaseAge) {
        return new LockError(
                LockErrorCode.ALREADY_LOCKED,
                "Lock is already held by: " + holderId,
                Optional.of(holderId),
                Optional.of(leaseAge)
        );
    }

    /**
     * Creates an error for a ledger failure.
     */
    public static LockError ledgerUnavailable(String resourceId, Throwable cause) {
        return new LockError(
                LockErrorCode.LEDGER_UNAVAILABLE,
                "Lock ledger unavailable for " + resourceId + ": " + cause.getMessage()
        );
    }

    /**
     * Creates an error for a coordinator that no longer accepts work.
     */
    public static LockError closed() {
        return new LockError(LockErrorCode.CLOSED, "Lock coordinator is closed");
    }

    public boolean isRetryable() {
        return code.isRetryable();
    }
}
