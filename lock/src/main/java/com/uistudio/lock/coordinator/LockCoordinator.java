/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.uistudio.lock.coordinator;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.uistudio.lock.bus.NotificationBus;
import com.uistudio.lock.bus.Subscription;
import com.uistudio.lock.config.LockConfig;
import com.uistudio.lock.ledger.LedgerException;
import com.uistudio.lock.ledger.LockLedger;
import com.uistudio.lock.model.LockError;
import com.uistudio.lock.model.LockRecord;
import com.uistudio.lock.model.LockResult;
import com.uistudio.lock.model.LockStatus;
import com.uistudio.lock.model.Notification;
import com.uistudio.lock.policy.LeasePolicy;
import com.uistudio.lock.relay.NotificationCodec;
import com.uistudio.lock.relay.NotificationObserver;
import com.uistudio.lock.relay.NotificationRelay;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Per-context lock coordinator. Arbitrates exclusive edit access to resources shared with
 * other contexts through the lock ledger, and keeps the leases it holds alive.
 *
 * <p>All ledger work runs on one scheduled thread owned by the coordinator, so operations,
 * the renewal task and inbound notification dispatch never interleave within a context.
 * Every operation therefore completes asynchronously.
 *
 * <p>Acquisition reads the record and then writes it; the two steps are not atomic against
 * the ledger. Two contexts racing on a free or stale resource can both succeed and both
 * believe they hold the lease until a renewal finds the other owner's record. Callers must
 * re-check {@link #status(String)} before destructive edits.
 */
@Slf4j
public class LockCoordinator implements AutoCloseable {

    private final LockLedger ledger;
    private final LeasePolicy policy;
    private final Clock clock;
    private final LockConfig config;
    private final String selfId;
    private final Set<String> heldResources = ConcurrentHashMap.newKeySet();
    private final ScheduledExecutorService executor;
    private final NotificationRelay relay;
    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();

    private volatile ScheduledFuture<?> renewalTask;
    private volatile Thread executorThread;

    public LockCoordinator(LockLedger ledger, NotificationBus bus, Clock clock,
                           ContextIdSource idSource, ObjectMapper objectMapper, LockConfig config) {
        this.ledger = ledger;
        this.clock = clock;
        this.config = config;
        this.policy = new LeasePolicy(config.getLeaseTimeout());
        this.selfId = idSource.newId();

        var threadName = "lock-coordinator-" + shortId(selfId);
        this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            var thread = new Thread(runnable, threadName);
            thread.setDaemon(true);
            executorThread = thread;
            return thread;
        });
        this.relay = new NotificationRelay(
                bus, new NotificationCodec(objectMapper), config.getTopic(), selfId, executor);
    }

    /**
     * Subscribes to notifications and schedules lease renewal.
     */
    public void start() {
        if (closed.get()) {
            throw new IllegalStateException("Lock coordinator is closed");
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }
        relay.start();
        long intervalMs = config.getRenewalIntervalMs();
        renewalTask = executor.scheduleAtFixedRate(
                this::scheduledRenewal, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Lock coordinator {} started: lease timeout {}, renewal every {}",
                selfId, config.getLeaseTimeout(), config.getRenewalInterval());
    }

    /**
     * Attempts to acquire the lease on a resource.
     *
     * @return true if this context now holds the lease, false if a live lease belongs to
     *         another context. Completes exceptionally with {@link LedgerException} when the
     *         ledger state could not be confirmed.
     */
    public CompletableFuture<Boolean> acquire(String resourceId) {
        LockRecord.requireResourceId(resourceId);
        return submit(() -> doAcquire(resourceId).isSuccess());
    }

    /**
     * Same as {@link #acquire(String)}, reporting contention, ledger failures and shutdown
     * as values instead of exceptions.
     */
    public CompletableFuture<LockResult<LockRecord>> tryAcquire(String resourceId) {
        LockRecord.requireResourceId(resourceId);
        if (closed.get()) {
            return CompletableFuture.completedFuture(LockResult.failure(LockError.closed()));
        }
        Supplier<LockResult<LockRecord>> task = () -> {
            try {
                return doAcquire(resourceId);
            } catch (LedgerException e) {
                log.warn("Could not confirm lock state for {}: {}", resourceId, e.getMessage());
                return LockResult.failure(LockError.ledgerUnavailable(resourceId, e));
            }
        };
        return submit(task);
    }

    /**
     * Releases the lease if this context holds it. Releasing a resource that was never
     * held, or that another context has since taken over, changes nothing.
     */
    public CompletableFuture<Void> release(String resourceId) {
        LockRecord.requireResourceId(resourceId);
        return submit(() -> {
            doRelease(resourceId);
            return null;
        });
    }

    /**
     * Releases every resource in the held set. Each resource is attempted even if an
     * earlier one fails; the first failure is reported with the others suppressed.
     */
    public CompletableFuture<Void> releaseAll() {
        return submit(this::doReleaseAll);
    }

    /**
     * Reads the current lock state. A stale record is reported as unlocked.
     */
    public CompletableFuture<LockStatus> status(String resourceId) {
        LockRecord.requireResourceId(resourceId);
        return submit(() -> policy.evaluate(ledger.get(resourceId), clock.instant(), selfId));
    }

    public CompletableFuture<Boolean> isLocked(String resourceId) {
        return status(resourceId).thenApply(LockStatus::locked);
    }

    /**
     * Id of the context holding a live lease on the resource, if any.
     */
    public CompletableFuture<Optional<String>> lockOwner(String resourceId) {
        return status(resourceId).thenApply(LockStatus::holderId);
    }

    /**
     * Runs one renewal cycle now.
     *
     * @return number of leases renewed
     */
    public CompletableFuture<Integer> renewHeld() {
        return submit(this::renewalCycle);
    }

    /**
     * To be called by the host when the context is suspended or moved to the background,
     * so that an inactive context does not look stale before it is actually gone.
     */
    public CompletableFuture<Integer> onBackgrounded() {
        log.debug("Context {} backgrounded, refreshing {} held locks", selfId, heldResources.size());
        return renewHeld();
    }

    public Subscription onNotification(NotificationObserver observer) {
        return relay.subscribe(observer);
    }

    public String getSelfId() {
        return selfId;
    }

    public LeasePolicy getPolicy() {
        return policy;
    }

    /**
     * Snapshot of the resources this context believes it holds.
     */
    public Set<String> heldResources() {
        return Set.copyOf(heldResources);
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Installs a JVM shutdown hook that closes this coordinator. Only needed when the
     * coordinator is not managed by a container that closes it.
     */
    public Thread registerShutdownHook() {
        var hook = new Thread(this::close, "lock-coordinator-shutdown-" + shortId(selfId));
        Runtime.getRuntime().addShutdownHook(hook);
        return hook;
    }

    /**
     * Stops renewal, releases every held lease with a bounded wait, stops the relay and
     * shuts the executor down. Renewal is cancelled first so that it cannot run after the
     * releases. When called from the coordinator's own thread (an observer closing it), the
     * releases run inline since nothing else can drain the queue.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        var task = renewalTask;
        if (task != null) {
            task.cancel(false);
        }

        boolean onExecutorThread = Thread.currentThread() == executorThread;
        int held = heldResources.size();
        try {
            if (onExecutorThread) {
                doReleaseAll();
            } else {
                CompletableFuture.supplyAsync(this::doReleaseAll, executor)
                        .get(config.getShutdownReleaseTimeoutMs(), TimeUnit.MILLISECONDS);
            }
            log.debug("Released {} locks on shutdown of {}", held, selfId);
        } catch (LedgerException e) {
            log.error("Failed to release locks on shutdown of {}", selfId, e);
        } catch (TimeoutException e) {
            log.error("Timed out releasing {} locks on shutdown of {}", held, selfId);
        } catch (ExecutionException e) {
            log.error("Failed to release locks on shutdown of {}", selfId, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while releasing locks on shutdown of {}", selfId);
        } catch (RejectedExecutionException e) {
            log.error("Executor of {} already stopped, locks left to expire", selfId);
        }

        relay.stop();
        executor.shutdown();
        if (onExecutorThread) {
            log.info("Lock coordinator {} closed from its own thread", selfId);
            return;
        }
        try {
            if (!executor.awaitTermination(config.getShutdownReleaseTimeoutMs(), TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Lock coordinator {} closed", selfId);
    }

    private LockResult<LockRecord> doAcquire(String resourceId) {
        var now = clock.instant();
        var existing = ledger.get(resourceId);

        if (!policy.isAcquirable(existing, now, selfId)) {
            var holder = existing.orElseThrow();
            log.debug("Lock {} held by {}", resourceId, holder.ownerId());
            return LockResult.failure(LockError.alreadyLocked(holder.ownerId(), policy.leaseAge(holder, now)));
        }

        var record = existing
                .filter(current -> current.isOwnedBy(selfId))
                .map(current -> current.renewedBy(now))
                .orElseGet(() -> LockRecord.create(resourceId, selfId, now));
        existing.filter(current -> !current.isOwnedBy(selfId))
                .ifPresent(stale -> log.info("Reclaiming stale lock {} from {}", resourceId, stale.ownerId()));

        ledger.put(record);
        heldResources.add(resourceId);
        log.debug("Lock acquired: {} by {}", resourceId, selfId);

        relay.publish(Notification.acquired(resourceId, selfId));
        return LockResult.success(record);
    }

    private void doRelease(String resourceId) {
        var existing = ledger.get(resourceId);
        if (existing.filter(current -> current.isOwnedBy(selfId)).isEmpty()) {
            heldResources.remove(resourceId);
            log.debug("Nothing to release for {}", resourceId);
            return;
        }

        ledger.delete(resourceId);
        heldResources.remove(resourceId);
        log.debug("Lock released: {} by {}", resourceId, selfId);

        relay.publish(Notification.released(resourceId, selfId));
    }

    private Void doReleaseAll() {
        LedgerException failure = null;
        for (var resourceId : List.copyOf(heldResources)) {
            try {
                doRelease(resourceId);
            } catch (LedgerException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
        return null;
    }

    private int renewalCycle() {
        int renewed = 0;
        for (var resourceId : List.copyOf(heldResources)) {
            try {
                var current = ledger.get(resourceId);
                if (!policy.isRenewable(current, selfId)) {
                    heldResources.remove(resourceId);
                    log.info("Lost lock {}: now held by {}", resourceId,
                            current.map(LockRecord::ownerId).orElse("nobody"));
                    continue;
                }
                ledger.put(current.orElseThrow().renewedBy(clock.instant()));
                relay.publish(Notification.ping(resourceId, selfId));
                renewed++;
            } catch (LedgerException e) {
                log.warn("Failed to refresh lock {}: {}", resourceId, e.getMessage());
            }
        }
        if (renewed > 0) {
            log.trace("Renewed {} locks for {}", renewed, selfId);
        }
        return renewed;
    }

    // A throwing task would silently stop the fixed-rate schedule.
    private void scheduledRenewal() {
        try {
            renewalCycle();
        } catch (RuntimeException e) {
            log.error("Lock renewal cycle failed for {}", selfId, e);
        }
    }

    private <T> CompletableFuture<T> submit(Supplier<T> task) {
        if (closed.get()) {
            return CompletableFuture.failedFuture(new IllegalStateException("Lock coordinator is closed"));
        }
        try {
            return CompletableFuture.supplyAsync(task, executor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(new IllegalStateException("Lock coordinator is closed", e));
        }
    }

    private static String shortId(String id) {
        return id.length() > 8 ? id.substring(0, 8) : id;
    }
}
