/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.uistudio.lock.integration;

import com.uistudio.lock.bus.InMemoryNotificationBus;
import com.uistudio.lock.ledger.JdbcLockLedger;
import com.uistudio.lock.model.LockRecord;
import com.uistudio.lock.model.Notification;
import com.uistudio.lock.model.NotificationType;
import com.uistudio.lock.support.MutableClock;
import com.uistudio.lock.support.TestCoordinators;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Several contexts sharing one H2-backed ledger and one notification bus.
 */
@Timeout(20)
class MultiContextLockTest {

    private EmbeddedDatabase database;
    private JdbcLockLedger ledger;
    private MutableClock clock;
    private TestCoordinators contexts;

    @BeforeEach
    void setUp() {
        database = new EmbeddedDatabaseBuilder()
                .setType(EmbeddedDatabaseType.H2)
                .generateUniqueName(true)
                .build();
        ledger = new JdbcLockLedger(new NamedParameterJdbcTemplate(database));
        ledger.createTableIfMissing();
        clock = MutableClock.startingNow();
        contexts = new TestCoordinators(ledger, new InMemoryNotificationBus(), clock,
                TestCoordinators.manualRenewalConfig());
    }

    @AfterEach
    void tearDown() {
        contexts.close();
        database.shutdown();
    }

    private static <T> T await(CompletableFuture<T> future) throws Exception {
        return future.get(5, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("Only one of several contexts should win a resource at a time")
    void singleWinnerAcrossContexts() throws Exception {
        var a = contexts.start("context-a");
        var b = contexts.start("context-b");
        var c = contexts.start("context-c");

        assertTrue(await(a.acquire("proj-1")));
        assertFalse(await(b.acquire("proj-1")));
        assertFalse(await(c.acquire("proj-1")));

        await(a.release("proj-1"));
        assertTrue(await(c.acquire("proj-1")));
        assertFalse(await(b.acquire("proj-1")));
        assertEquals("context-c", await(a.lockOwner("proj-1")).orElseThrow());
    }

    @Test
    @DisplayName("A renewing holder should keep its lease while a crashed one loses it")
    void renewingHolderSurvivesCrashedDoesNot() throws Exception {
        var live = contexts.start("live");
        var crashed = contexts.start("crashed");
        var newcomer = contexts.start("newcomer");

        assertTrue(await(live.acquire("proj-live")));
        assertTrue(await(crashed.acquire("proj-crashed")));

        // The crashed context never renews again.
        for (int i = 0; i < 11; i++) {
            clock.advance(Duration.ofSeconds(30));
            await(live.renewHeld());
        }

        assertFalse(await(newcomer.acquire("proj-live")));
        assertTrue(await(newcomer.acquire("proj-crashed")));

        assertEquals(0, await(crashed.renewHeld()));
        assertTrue(crashed.heldResources().isEmpty());
    }

    @Test
    @DisplayName("Closing a context should free its resources for the others")
    void closeFreesResources() throws Exception {
        var a = contexts.start("context-a");
        var b = contexts.start("context-b");
        assertTrue(await(a.acquire("proj-4")));
        assertTrue(await(a.acquire("proj-5")));

        a.close();

        assertTrue(await(b.acquire("proj-4")));
        assertTrue(await(b.acquire("proj-5")));
    }

    @Test
    @DisplayName("Observers should see the lock move between contexts")
    void observersSeeHandOver() throws Exception {
        var a = contexts.start("context-a");
        var b = contexts.start("context-b");
        var watcher = contexts.start("watcher");
        List<Notification> seen = new CopyOnWriteArrayList<>();
        var handedOver = new CompletableFuture<Void>();
        watcher.onNotification(notification -> {
            seen.add(notification);
            if (notification.type() == NotificationType.ACQUIRED && notification.ownerId().equals("context-b")) {
                handedOver.complete(null);
            }
        });

        assertTrue(await(a.acquire("proj-1")));
        await(a.release("proj-1"));
        assertTrue(await(b.acquire("proj-1")));
        await(handedOver);

        assertEquals(List.of(
                Notification.acquired("proj-1", "context-a"),
                Notification.released("proj-1", "context-a"),
                Notification.acquired("proj-1", "context-b")
        ), seen);
    }

    @Test
    @DisplayName("A record left behind by a process that never closed should be reclaimed")
    void ghostRecordReclaimed() throws Exception {
        ledger.put(new LockRecord("proj-2", "ghost", clock.instant().minus(Duration.ofMinutes(6))));
        var c = contexts.start("context-c");

        assertFalse(await(c.isLocked("proj-2")));
        assertTrue(await(c.acquire("proj-2")));
        assertEquals("context-c", ledger.get("proj-2").orElseThrow().ownerId());
    }
}
