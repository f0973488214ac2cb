/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.uistudio.lock.model;

/**
 * Reason a lock operation did not succeed.
 */
public enum LockErrorCode {
    /**
     * A live lease for the resource is held by another context.
     */
    ALREADY_LOCKED,

    /**
     * The ledger could not be read or written.
     */
    LEDGER_UNAVAILABLE,

    /**
     * The coordinator has been closed.
     */
    CLOSED;

    /**
     * Checks if the same request may succeed when simply tried again.
     */
    public boolean isRetryable() {
        return this == LEDGER_UNAVAILABLE;
    }
}
