package com.example.spontaneous.notification.service;

import com.example.spontaneous.shared.dto.JoinRequestedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@Slf4j
public class JoinRequestNotificationConsumer {

    private final JoinRequestNotificationService notificationService;

    @KafkaListener(
            topics = "#{@kafkaListenerHelper.getJoinRequestsTopic()}",
            groupId = "#{@kafkaListenerHelper.getNotificationGroupId()}",
            containerFactory = "#{@kafkaListenerHelper.getNotificationListenerContainerFactory()}"
    )
    public void onJoinRequested(@Payload JoinRequestedEvent event,
                                Acknowledgment acknowledgment,
                                @Header(KafkaHeaders.RECEIVED_TOPIC) String topic,
                                @Header(KafkaHeaders.RECEIVED_PARTITION) int partition,
                                @Header(KafkaHeaders.OFFSET) long offset) {

        log.debug("Join request event received. [Topic: {}, Partition: {}, Offset: {}] Payload: {}",
                topic, partition, offset, event);

        // failures propagate to the container's error handler, which retries and dead-letters
        NotificationOutcome outcome = notificationService.process(event);
        log.info("Join request event for broadcast {} by {} handled: {}", event.getBroadcastId(), event.getRequesterId(), outcome);
        acknowledgment.acknowledge();
    }
}
