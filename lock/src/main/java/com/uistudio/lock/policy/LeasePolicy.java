/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.uistudio.lock.policy;

import com.uistudio.lock.model.LockRecord;
import com.uistudio.lock.model.LockStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Decides staleness, ownership and renewal eligibility of lock records.
 * Pure and deterministic: every answer depends only on the arguments and the lease timeout.
 */
public final class LeasePolicy {

    public static final Duration DEFAULT_LEASE_TIMEOUT = Duration.ofMinutes(5);
    public static final Duration DEFAULT_RENEWAL_INTERVAL = Duration.ofSeconds(30);

    private final Duration leaseTimeout;

    public LeasePolicy(Duration leaseTimeout) {
        Objects.requireNonNull(leaseTimeout, "leaseTimeout must not be null");
        if (leaseTimeout.isZero() || leaseTimeout.isNegative()) {
            throw new IllegalArgumentException("leaseTimeout must be positive");
        }
        this.leaseTimeout = leaseTimeout;
    }

    public static LeasePolicy withDefaults() {
        return new LeasePolicy(DEFAULT_LEASE_TIMEOUT);
    }

    public Duration leaseTimeout() {
        return leaseTimeout;
    }

    /**
     * Age of the lease at {@code now}. A record stamped in the future has age zero.
     */
    public Duration leaseAge(LockRecord record, Instant now) {
        var age = Duration.between(record.renewedAt(), now);
        return age.isNegative() ? Duration.ZERO : age;
    }

    /**
     * A record is stale once its age reaches the lease timeout.
     */
    public boolean isStale(LockRecord record, Instant now) {
        return record != null && leaseAge(record, now).compareTo(leaseTimeout) >= 0;
    }

    /**
     * A resource is acquirable when there is no record, the record is ours, or it is stale.
     */
    public boolean isAcquirable(Optional<LockRecord> record, Instant now, String selfId) {
        return record
                .map(existing -> existing.isOwnedBy(selfId) || isStale(existing, now))
                .orElse(true);
    }

    public boolean isOwnedBy(LockRecord record, String selfId) {
        return record != null && record.isOwnedBy(selfId);
    }

    /**
     * Only the owner named in the record may renew it. Staleness does not matter: a late
     * renewal by the rightful owner simply revives its own lease.
     */
    public boolean isRenewable(Optional<LockRecord> record, String selfId) {
        return record.filter(existing -> existing.isOwnedBy(selfId)).isPresent();
    }

    /**
     * Derives the status a context reports for a record.
     */
    public LockStatus evaluate(Optional<LockRecord> record, Instant now, String selfId) {
        return record
                .filter(existing -> !isStale(existing, now))
                .map(live -> LockStatus.heldBy(
                        live.ownerId(),
                        live.isOwnedBy(selfId),
                        leaseAge(live, now)
                ))
                .orElseGet(LockStatus::unlocked);
    }
}
