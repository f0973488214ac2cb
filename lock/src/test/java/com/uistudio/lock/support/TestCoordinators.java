/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.uistudio.lock.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.uistudio.lock.bus.NotificationBus;
import com.uistudio.lock.config.LockConfig;
import com.uistudio.lock.coordinator.LockCoordinator;
import com.uistudio.lock.ledger.LockLedger;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds coordinators that share one ledger, bus and clock, and closes them after a test.
 */
public class TestCoordinators implements AutoCloseable {

    private final LockLedger ledger;
    private final NotificationBus bus;
    private final Clock clock;
    private final LockConfig config;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<LockCoordinator> created = new ArrayList<>();

    public TestCoordinators(LockLedger ledger, NotificationBus bus, Clock clock, LockConfig config) {
        this.ledger = ledger;
        this.bus = bus;
        this.clock = clock;
        this.config = config;
    }

    /**
     * Config whose renewal task never fires during a test; renewal is driven by hand.
     */
    public static LockConfig manualRenewalConfig() {
        var config = new LockConfig();
        config.setLeaseTimeoutMs(300_000);
        config.setRenewalIntervalMs(60_000);
        config.setShutdownReleaseTimeoutMs(2_000);
        return config;
    }

    public LockCoordinator start(String contextId) {
        var coordinator = new LockCoordinator(ledger, bus, clock, () -> contextId, objectMapper, config);
        coordinator.start();
        created.add(coordinator);
        return coordinator;
    }

    @Override
    public void close() {
        created.forEach(LockCoordinator::close);
    }
}
