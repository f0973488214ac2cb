/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.uistudio.lock.bus;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-JVM bus. Publishing hands the message to every handler on the caller's thread;
 * handlers are expected to return quickly.
 */
@Slf4j
public class InMemoryNotificationBus implements NotificationBus {

    private final Map<String, List<Consumer<String>>> handlers = new ConcurrentHashMap<>();

    @Override
    public void publish(String topic, String message) {
        var topicHandlers = handlers.get(topic);
        if (topicHandlers == null) {
            return;
        }
        for (var handler : topicHandlers) {
            try {
                handler.accept(message);
            } catch (RuntimeException e) {
                log.warn("Bus handler failed on topic {}: {}", topic, e.getMessage());
            }
        }
    }

    @Override
    public Subscription subscribe(String topic, Consumer<String> handler) {
        handlers.computeIfAbsent(topic, key -> new CopyOnWriteArrayList<>()).add(handler);
        log.debug("Subscribed to topic {}", topic);
        return () -> {
            var topicHandlers = handlers.get(topic);
            if (topicHandlers != null && topicHandlers.remove(handler)) {
                log.debug("Unsubscribed from topic {}", topic);
            }
        };
    }

    /**
     * Number of live subscriptions on a topic.
     */
    public int subscriberCount(String topic) {
        var topicHandlers = handlers.get(topic);
        return topicHandlers == null ? 0 : topicHandlers.size();
    }
}
