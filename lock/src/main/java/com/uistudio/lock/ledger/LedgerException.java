/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.uistudio.lock.ledger;

/**
 * Thrown when the lock ledger cannot be read or written.
 * Never to be interpreted as "not locked".
 */
public class LedgerException extends RuntimeException {

    private final String resourceId;

    public LedgerException(String resourceId, String message, Throwable cause) {
        super(message, cause);
        this.resourceId = resourceId;
    }

    public LedgerException(String resourceId, String message) {
        this(resourceId, message, null);
    }

    public String getResourceId() {
        return resourceId;
    }
}
