package com.example.spontaneous.notification.service;

import com.example.spontaneous.notification.dto.CreatorNotification;
import com.example.spontaneous.shared.config.MonitoringConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Default dispatcher: writes the notification to the log. Push or email delivery plugs in
 * by providing another {@link NotificationDispatcher} bean.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LoggingNotificationDispatcher implements NotificationDispatcher {

    private final MonitoringConfig.BroadcastMetricsCollector metricsCollector;

    @Override
    public void dispatch(CreatorNotification notification) {
        log.info("Notify {}: user {} asked to join broadcast {} ('{}')",
                notification.getRecipientId(), notification.getRequesterId(),
                notification.getBroadcastId(), notification.getBroadcastTitle());
        metricsCollector.incrementCounter(MonitoringConfig.NOTIFICATIONS_DISPATCHED, "channel", "log");
    }
}
