/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.uistudio.lock.relay;

import com.uistudio.lock.bus.NotificationBus;
import com.uistudio.lock.bus.Subscription;
import com.uistudio.lock.model.Notification;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Bridges one coordinator and the bus.
 *
 * <p>Outbound notifications are fire-and-forget: a publish failure is logged and never
 * reaches the lock operation that triggered it. Inbound payloads are validated, messages
 * from this context are ignored, and the rest are fanned out on the dispatch executor to
 * every registered observer, each in isolation.
 */
@Slf4j
public class NotificationRelay {

    private final NotificationBus bus;
    private final NotificationCodec codec;
    private final String topic;
    private final String selfId;
    private final Executor dispatchExecutor;
    private final Map<String, NotificationObserver> observers = new ConcurrentHashMap<>();

    private volatile Subscription busSubscription;

    public NotificationRelay(NotificationBus bus, NotificationCodec codec, String topic,
                             String selfId, Executor dispatchExecutor) {
        this.bus = Objects.requireNonNull(bus, "bus must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.topic = Objects.requireNonNull(topic, "topic must not be null");
        this.selfId = Objects.requireNonNull(selfId, "selfId must not be null");
        this.dispatchExecutor = Objects.requireNonNull(dispatchExecutor, "dispatchExecutor must not be null");
    }

    /**
     * Subscribes to the bus. Calling it again while subscribed does nothing.
     * A failed subscription is logged; the coordinator keeps working without inbound hints.
     */
    public synchronized void start() {
        if (busSubscription != null) {
            return;
        }
        try {
            busSubscription = bus.subscribe(topic, this::handleInbound);
            log.debug("Relay for {} subscribed to {}", selfId, topic);
        } catch (RuntimeException e) {
            log.warn("Relay for {} could not subscribe to {}: {}", selfId, topic, e.getMessage());
        }
    }

    public synchronized void stop() {
        if (busSubscription != null) {
            try {
                busSubscription.unsubscribe();
            } catch (RuntimeException e) {
                log.warn("Relay for {} failed to unsubscribe from {}: {}", selfId, topic, e.getMessage());
            }
            busSubscription = null;
        }
        observers.clear();
    }

    public boolean isStarted() {
        return busSubscription != null;
    }

    public void publish(Notification notification) {
        try {
            bus.publish(topic, codec.encode(notification));
        } catch (RuntimeException e) {
            log.warn("Failed to broadcast lock message {} for {}: {}",
                    notification.type(), notification.resourceId(), e.getMessage());
        }
    }

    /**
     * Registers an observer.
     *
     * @return handle that removes the observer
     */
    public Subscription subscribe(NotificationObserver observer) {
        Objects.requireNonNull(observer, "observer must not be null");
        var handle = UUID.randomUUID().toString();
        observers.put(handle, observer);
        return () -> observers.remove(handle);
    }

    public int observerCount() {
        return observers.size();
    }

    void handleInbound(String payload) {
        var decoded = codec.decode(payload);
        if (decoded.isEmpty()) {
            log.debug("Dropping malformed lock message on {}: {}", topic, payload);
            return;
        }
        var notification = decoded.get();
        if (notification.ownerId().equals(selfId)) {
            return;
        }
        try {
            dispatchExecutor.execute(() -> dispatch(notification));
        } catch (RejectedExecutionException e) {
            log.debug("Relay for {} is shutting down, dropping {}", selfId, notification);
        }
    }

    private void dispatch(Notification notification) {
        observers.values().forEach(observer -> {
            try {
                observer.onNotification(notification);
            } catch (RuntimeException e) {
                log.error("Lock message handler error for {}", notification, e);
            }
        });
    }
}
