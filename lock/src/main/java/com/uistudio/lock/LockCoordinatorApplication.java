/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.uistudio.lock;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Main application class for the UI Studio lock coordinator.
 *
 * <p>Each running process is one context. Contexts share a lock ledger (a relational
 * table) and an advisory notification bus, and use them to make sure that at most one
 * context at a time edits a given instance:
 * <ul>
 *   <li>acquire - take the lease on an instance, or learn who holds it</li>
 *   <li>release - give the lease back</li>
 *   <li>status - inspect the lease, treating expired leases as free</li>
 * </ul>
 *
 * <p>Held leases are renewed in the background and released when the process shuts down.
 */
@SpringBootApplication
@EnableConfigurationProperties
public class LockCoordinatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(LockCoordinatorApplication.class, args);
    }
}
