/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.uistudio.lock.web;

import com.uistudio.lock.bus.InMemoryNotificationBus;
import com.uistudio.lock.coordinator.LockCoordinator;
import com.uistudio.lock.ledger.LedgerException;
import com.uistudio.lock.support.FlakyLockLedger;
import com.uistudio.lock.support.MutableClock;
import com.uistudio.lock.support.TestCoordinators;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.springframework.http.HttpStatus;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(10)
class LockControllerTest {

    private FlakyLockLedger ledger;
    private TestCoordinators contexts;
    private LockCoordinator local;
    private LockCoordinator remote;
    private LockController controller;

    @BeforeEach
    void setUp() {
        ledger = new FlakyLockLedger();
        contexts = new TestCoordinators(ledger, new InMemoryNotificationBus(), MutableClock.startingNow(),
                TestCoordinators.manualRenewalConfig());
        local = contexts.start("local");
        remote = contexts.start("remote");
        controller = new LockController(local);
    }

    @AfterEach
    void tearDown() {
        ledger.setFailing(false);
        contexts.close();
    }

    private static <T> T await(CompletableFuture<T> future) throws Exception {
        return future.get(5, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("POST should acquire and report the new lease")
    void acquireReturnsOk() throws Exception {
        var response = await(controller.acquire("doc-1"));

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertTrue(response.getBody().acquired());
        assertEquals("local", response.getBody().holderId());
        assertNotNull(response.getBody().renewedAt());
    }

    @Test
    @DisplayName("POST on a resource held elsewhere should be a conflict naming the holder")
    void acquireConflict() throws Exception {
        assertTrue(await(remote.acquire("doc-1")));

        var response = await(controller.acquire("doc-1"));

        assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
        assertFalse(response.getBody().acquired());
        assertEquals("remote", response.getBody().holderId());
        assertFalse(response.getBody().retryable());
    }

    @Test
    @DisplayName("POST with the ledger down should be unavailable and retryable")
    void acquireLedgerDown() throws Exception {
        ledger.setFailing(true);

        var response = await(controller.acquire("doc-1"));

        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, response.getStatusCode());
        assertTrue(response.getBody().retryable());
    }

    @Test
    @DisplayName("GET should describe the lock as seen by this context")
    void statusDescribesLock() throws Exception {
        assertTrue(await(remote.acquire("doc-1")));

        var body = await(controller.status("doc-1")).getBody();

        assertTrue(body.locked());
        assertFalse(body.ownedBySelf());
        assertEquals("remote", body.holderId());
        assertEquals(0L, body.leaseAgeMs());

        var free = await(controller.status("doc-2")).getBody();
        assertFalse(free.locked());
        assertNull(free.holderId());
        assertNull(free.leaseAgeMs());
    }

    @Test
    @DisplayName("GET on the collection should list held resources in order")
    void heldListsResources() throws Exception {
        await(controller.acquire("doc-b"));
        await(controller.acquire("doc-a"));

        var body = controller.held().getBody();

        assertEquals("local", body.contextId());
        assertEquals(List.of("doc-a", "doc-b"), List.copyOf(body.resourceIds()));
    }

    @Test
    @DisplayName("DELETE should release and return no content")
    void releaseReturnsNoContent() throws Exception {
        await(controller.acquire("doc-1"));

        var response = await(controller.release("doc-1"));

        assertEquals(HttpStatus.NO_CONTENT, response.getStatusCode());
        assertEquals(Set.of(), local.heldResources());
        assertTrue(await(remote.acquire("doc-1")));
    }

    @Test
    @DisplayName("POST renewals should report how many leases were renewed")
    void renewReportsCount() throws Exception {
        await(controller.acquire("doc-1"));
        await(controller.acquire("doc-2"));

        var response = await(controller.renew());

        assertEquals(HttpStatus.ACCEPTED, response.getStatusCode());
        assertEquals(2, response.getBody().renewed());
    }

    @Test
    @DisplayName("Exception handler should map failures to HTTP statuses")
    void exceptionHandlerMapsStatuses() {
        var handler = new LockApiExceptionHandler();

        assertEquals(HttpStatus.SERVICE_UNAVAILABLE,
                handler.ledgerUnavailable(new LedgerException("doc-1", "down")).getStatusCode());
        assertEquals(HttpStatus.BAD_REQUEST,
                handler.badRequest(new IllegalArgumentException("resourceId must not be blank")).getStatusCode());
        assertEquals(HttpStatus.SERVICE_UNAVAILABLE,
                handler.closed(new IllegalStateException("Lock coordinator is closed")).getStatusCode());
    }
}
