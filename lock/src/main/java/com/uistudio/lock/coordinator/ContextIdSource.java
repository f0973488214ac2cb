/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.uistudio.lock.coordinator;

/**
 * Produces the opaque identity of an execution context. Called once per coordinator.
 */
@FunctionalInterface
public interface ContextIdSource {

    String newId();
}
