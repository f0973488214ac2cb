/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.uistudio.lock.ledger;

import com.uistudio.lock.model.LockRecord;

import java.util.Optional;

/**
 * Access to the durable table of lock records, keyed by resource id.
 * Writes are last-write-wins; there is no conditional update.
 *
 * <p>All methods throw {@link LedgerException} when the underlying store fails.
 */
public interface LockLedger {

    Optional<LockRecord> get(String resourceId);

    /**
     * Inserts or overwrites the record for {@code record.resourceId()}.
     */
    void put(LockRecord record);

    /**
     * Removes the record if present. Deleting a missing record is not an error.
     */
    void delete(String resourceId);
}
