/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.uistudio.lock.ledger;

import com.uistudio.lock.model.LockRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe in-memory lock ledger. Coordinators sharing one instance behave like
 * contexts sharing one durable store.
 */
@Slf4j
public class InMemoryLockLedger implements LockLedger {

    private final Map<String, LockRecord> records = new ConcurrentHashMap<>();

    @Override
    public Optional<LockRecord> get(String resourceId) {
        return Optional.ofNullable(records.get(resourceId));
    }

    @Override
    public void put(LockRecord record) {
        records.put(record.resourceId(), record);
        log.trace("Lock record written: {} owner={}", record.resourceId(), record.ownerId());
    }

    @Override
    public void delete(String resourceId) {
        if (records.remove(resourceId) != null) {
            log.trace("Lock record deleted: {}", resourceId);
        }
    }

    /**
     * Snapshot of every stored record, live or stale.
     */
    public Collection<LockRecord> getAll() {
        return List.copyOf(records.values());
    }

    /**
     * Clears all records (for testing).
     */
    public void clear() {
        records.clear();
        log.warn("All lock records cleared");
    }
}
