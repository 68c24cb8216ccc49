package com.example.spontaneous.lifecycle.service;

import com.example.spontaneous.shared.config.AppProperties;
import com.example.spontaneous.shared.config.MonitoringConfig;
import com.example.spontaneous.shared.dto.JoinRequestedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

/**
 * Fire-and-forget hand-off of committed join requests to the notification topic. Send
 * failures are logged and counted; the join request itself stays committed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JoinRequestNotificationPublisher {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final AppProperties appProperties;
    private final MonitoringConfig.BroadcastMetricsCollector metricsCollector;

    public void publish(JoinRequestedEvent event) {
        String topic = appProperties.getKafka().getTopic().getNameJoinRequests();
        try {
            kafkaTemplate.send(topic, event.getBroadcastId(), event)
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            metricsCollector.incrementCounter(MonitoringConfig.NOTIFICATIONS_PUBLISHED, "status", "failed");
                            log.warn("Failed to publish join request notification for broadcast {} by {}: {}",
                                    event.getBroadcastId(), event.getRequesterId(), ex.getMessage());
                        } else {
                            metricsCollector.incrementCounter(MonitoringConfig.NOTIFICATIONS_PUBLISHED, "status", "success");
                            log.debug("Published join request notification for broadcast {} to {}-{}@{}",
                                    event.getBroadcastId(), topic,
                                    result.getRecordMetadata().partition(), result.getRecordMetadata().offset());
                        }
                    });
        } catch (Exception e) {
            metricsCollector.incrementCounter(MonitoringConfig.NOTIFICATIONS_PUBLISHED, "status", "failed");
            log.warn("Could not hand join request notification for broadcast {} to Kafka: {}",
                    event.getBroadcastId(), e.getMessage());
        }
    }
}
