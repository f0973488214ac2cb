/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.uistudio.lock.relay;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.uistudio.lock.bus.BusException;
import com.uistudio.lock.model.Notification;
import com.uistudio.lock.model.NotificationType;

import java.util.Optional;

/**
 * JSON wire format of lock notifications:
 * {@code {"type":"acquired","resourceId":"proj-1","ownerId":"..."}}.
 */
public class NotificationCodec {

    private final ObjectMapper objectMapper;

    public NotificationCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(Notification notification) {
        try {
            return objectMapper.writeValueAsString(notification);
        } catch (JsonProcessingException e) {
            throw new BusException("Failed to encode lock notification: " + notification, e);
        }
    }

    /**
     * Decodes and validates a payload. Returns empty for anything that is not a
     * well-formed notification.
     */
    public Optional<Notification> decode(String payload) {
        if (payload == null || payload.isBlank()) {
            return Optional.empty();
        }
        try {
            var node = objectMapper.readTree(payload);
            if (node == null || !node.isObject()) {
                return Optional.empty();
            }
            var type = node.path("type");
            var resourceId = node.path("resourceId");
            var ownerId = node.path("ownerId");
            if (!type.isTextual() || !resourceId.isTextual() || !ownerId.isTextual()) {
                return Optional.empty();
            }
            return Optional.of(new Notification(
                    NotificationType.fromWireName(type.asText()),
                    resourceId.asText(),
                    ownerId.asText()
            ));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
