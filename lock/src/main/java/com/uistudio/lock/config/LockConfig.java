/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.uistudio.lock.config;

import com.uistudio.lock.ledger.JdbcLockLedger;
import com.uistudio.lock.policy.LeasePolicy;
import lombok.Data;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import jakarta.annotation.PostConstruct;
import java.time.Duration;

/**
 * Configuration for lease timing, the notification topic and the ledger and bus backends.
 */
@Slf4j
@Configuration
@ConfigurationProperties(prefix = "uistudio.lock")
@Getter
@Setter
public class LockConfig {

    public static final String DEFAULT_TOPIC = "ui-studio-locks";

    private long leaseTimeoutMs = LeasePolicy.DEFAULT_LEASE_TIMEOUT.toMillis();
    private long renewalIntervalMs = LeasePolicy.DEFAULT_RENEWAL_INTERVAL.toMillis();
    private long shutdownReleaseTimeoutMs = 2000;
    private String topic = DEFAULT_TOPIC;

    private Ledger ledger = new Ledger();
    private Bus bus = new Bus();

    /**
     * Rejects timings under which a live owner could look stale.
     */
    @PostConstruct
    public void validate() {
        if (leaseTimeoutMs <= 0 || renewalIntervalMs <= 0) {
            throw new IllegalStateException("Lease timeout and renewal interval must be positive");
        }
        if (renewalIntervalMs >= leaseTimeoutMs) {
            throw new IllegalStateException(String.format(
                    "Renewal interval (%d ms) must be shorter than the lease timeout (%d ms)",
                    renewalIntervalMs, leaseTimeoutMs));
        }
        if (renewalIntervalMs * 3 > leaseTimeoutMs) {
            log.warn("Renewal interval {} ms leaves little margin inside lease timeout {} ms",
                    renewalIntervalMs, leaseTimeoutMs);
        }
        if (topic == null || topic.isBlank()) {
            throw new IllegalStateException("Lock notification topic must not be blank");
        }
    }

    public Duration getLeaseTimeout() {
        return Duration.ofMillis(leaseTimeoutMs);
    }

    public Duration getRenewalInterval() {
        return Duration.ofMillis(renewalIntervalMs);
    }

    public Duration getShutdownReleaseTimeout() {
        return Duration.ofMillis(shutdownReleaseTimeoutMs);
    }

    @Data
    public static class Ledger {
        /**
         * jdbc or memory.
         */
        private String type = "jdbc";
        private String table = JdbcLockLedger.DEFAULT_TABLE;
    }

    @Data
    public static class Bus {
        /**
         * memory or kafka.
         */
        private String type = "memory";
        private String groupPrefix = DEFAULT_TOPIC;
    }
}
