package com.example.spontaneous.notification.service;

import com.example.spontaneous.notification.dto.CreatorNotification;

/**
 * Delivers a notification to a broadcast creator. Implementations throw on failure so the
 * listener container can retry the record.
 */
public interface NotificationDispatcher {

    void dispatch(CreatorNotification notification);
}
