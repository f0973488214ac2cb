/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.uistudio.lock.bus;

import java.util.function.Consumer;

/**
 * Best-effort multicast channel between contexts, scoped by topic.
 * Delivery, ordering and deduplication are not guaranteed.
 */
public interface NotificationBus {

    /**
     * Publishes a message to every subscriber of the topic.
     *
     * @throws BusException if the message could not be handed to the transport
     */
    void publish(String topic, String message);

    /**
     * Registers a handler for messages on the topic.
     *
     * @throws BusException if the subscription could not be established
     */
    Subscription subscribe(String topic, Consumer<String> handler);
}
