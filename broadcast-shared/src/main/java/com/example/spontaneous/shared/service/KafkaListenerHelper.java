package com.example.spontaneous.shared.service;

import com.example.spontaneous.shared.config.AppProperties;
import com.example.spontaneous.shared.util.Constants;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Exposes topic and group names to {@code @KafkaListener} SpEL expressions.
 */
@Service
@RequiredArgsConstructor
public class KafkaListenerHelper {

    private final AppProperties appProperties;

    private static final String NOTIFICATION_LISTENER_CONTAINER_FACTORY = "kafkaListenerContainerFactory";
    private static final String DLT_LISTENER_CONTAINER_FACTORY = "dltListenerContainerFactory";

    public String getJoinRequestsTopic() {
        return appProperties.getKafka().getTopic().getNameJoinRequests();
    }

    public String getJoinRequestsDltTopic() {
        return getJoinRequestsTopic() + Constants.DLT_SUFFIX;
    }

    public String getNotificationGroupId() {
        return appProperties.getKafka().getConsumer().getGroupNotification();
    }

    public String getDltGroupId() {
        return appProperties.getKafka().getConsumer().getGroupDlt();
    }

    public String getNotificationListenerContainerFactory() {
        return NOTIFICATION_LISTENER_CONTAINER_FACTORY;
    }

    public String getDltListenerContainerFactory() {
        return DLT_LISTENER_CONTAINER_FACTORY;
    }
}
