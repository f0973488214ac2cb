/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.uistudio.lock.relay;

import com.uistudio.lock.model.Notification;

/**
 * Receives lock notifications from other contexts. Notifications are hints; observers
 * that need the truth must ask the coordinator for the status.
 */
@FunctionalInterface
public interface NotificationObserver {

    void onNotification(Notification notification);
}
