/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.uistudio.lock.session;

import com.uistudio.lock.coordinator.LockCoordinator;
import com.uistudio.lock.ledger.LedgerException;
import com.uistudio.lock.model.LockRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One editor's hold on an instance: acquires the lock when opened, exposes whether editing
 * is allowed and why not, and releases the lock when closed.
 */
@Slf4j
public class EditSession implements AutoCloseable {

    public static final String HELD_ELSEWHERE = "This instance is already open in another tab or window";
    public static final String STILL_HELD = "This instance is still locked by another tab";
    public static final String LOST = "This instance was taken over by another tab";

    private final LockCoordinator coordinator;
    private final String resourceId;
    private final AtomicBoolean closed = new AtomicBoolean();

    private volatile boolean hasLock;
    private volatile String lockError;

    private EditSession(LockCoordinator coordinator, String resourceId) {
        this.coordinator = coordinator;
        this.resourceId = LockRecord.requireResourceId(resourceId);
    }

    /**
     * Opens a session and tries to take the lock. The returned session is usable whether or
     * not the lock was obtained; check {@link #hasLock()}.
     */
    public static CompletableFuture<EditSession> open(LockCoordinator coordinator, String resourceId) {
        var session = new EditSession(coordinator, resourceId);
        return session.attempt(HELD_ELSEWHERE).thenApply(acquired -> session);
    }

    /**
     * Tries again to take the lock after a failed open.
     */
    public CompletableFuture<Boolean> retry() {
        if (closed.get()) {
            return CompletableFuture.failedFuture(new IllegalStateException("Edit session is closed"));
        }
        return attempt(STILL_HELD);
    }

    /**
     * Re-reads the lock state; to be called before destructive edits since a lease can be
     * lost without notice.
     */
    public CompletableFuture<Boolean> verify() {
        return coordinator.status(resourceId).thenApply(status -> {
            boolean owned = status.ownedBySelf();
            if (hasLock && !owned) {
                log.info("Edit session for {} lost its lock", resourceId);
                lockError = LOST;
            }
            hasLock = owned;
            return owned;
        });
    }

    public boolean hasLock() {
        return hasLock;
    }

    public Optional<String> lockError() {
        return Optional.ofNullable(lockError);
    }

    public String getResourceId() {
        return resourceId;
    }

    /**
     * Releases the lock. Runs whether or not the session currently believes it holds it: an
     * acquire still in flight may land its write, and the release is queued behind it.
     * The coordinator only deletes a lease this context owns.
     */
    public CompletableFuture<Void> closeAsync() {
        if (!closed.compareAndSet(false, true)) {
            return CompletableFuture.completedFuture(null);
        }
        hasLock = false;
        return coordinator.release(resourceId);
    }

    @Override
    public void close() {
        closeAsync().whenComplete((ignored, ex) -> {
            if (ex != null) {
                log.error("Failed to release lock for {} on session close", resourceId, ex);
            }
        });
    }

    private CompletableFuture<Boolean> attempt(String contendedMessage) {
        return coordinator.acquire(resourceId).handle((acquired, ex) -> {
            if (ex != null) {
                var cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                if (!(cause instanceof LedgerException)) {
                    throw new CompletionException(cause);
                }
                hasLock = false;
                lockError = cause.getMessage();
                return false;
            }
            if (closed.get()) {
                if (acquired) {
                    log.debug("Edit session for {} closed while acquiring, giving the lock back", resourceId);
                    releaseQuietly();
                }
                return false;
            }
            hasLock = acquired;
            lockError = acquired ? null : contendedMessage;
            return acquired;
        });
    }

    private void releaseQuietly() {
        coordinator.release(resourceId).whenComplete((ignored, ex) -> {
            if (ex != null) {
                log.error("Failed to give back lock for {} after close", resourceId, ex);
            }
        });
    }
}
