/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.uistudio.lock.model;

import java.util.Objects;

/**
 * Transient, advisory message about a lock transition. Never read back as ground truth.
 */
public record Notification(
        NotificationType type,
        String resourceId,
        String ownerId
) {
    public Notification {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(resourceId, "resourceId must not be null");
        Objects.requireNonNull(ownerId, "ownerId must not be null");

        if (resourceId.isBlank() || ownerId.isBlank()) {
            throw new IllegalArgumentException("resourceId and ownerId must not be blank");
        }
    }

    public static Notification acquired(String resourceId, String ownerId) {
        return new Notification(NotificationType.ACQUIRED, resourceId, ownerId);
    }

    public static Notification released(String resourceId, String ownerId) {
        return new Notification(NotificationType.RELEASED, resourceId, ownerId);
    }

    public static Notification ping(String resourceId, String ownerId) {
        return new Notification(NotificationType.PING, resourceId, ownerId);
    }
}
