package com.example.spontaneous.notification.service;

import com.example.spontaneous.notification.model.DeadLetterNotification;
import com.example.spontaneous.notification.repository.DeadLetterNotificationRepository;
import com.example.spontaneous.shared.dto.JoinRequestedEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.apache.kafka.common.header.Headers;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.stereotype.Service;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Records every event that reached the dead-letter topic. Values are read as raw strings so
 * payloads that never deserialized are kept as-is for inspection and redrive.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeadLetterConsumerService {

    private static final int MAX_PAYLOAD_LENGTH = 10000;

    private final DeadLetterNotificationRepository deadLetterRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @KafkaListener(
            topics = "#{@kafkaListenerHelper.getJoinRequestsDltTopic()}",
            groupId = "#{@kafkaListenerHelper.getDltGroupId()}",
            containerFactory = "#{@kafkaListenerHelper.getDltListenerContainerFactory()}"
    )
    public void onDeadLetter(ConsumerRecord<String, String> record, Acknowledgment acknowledgment) {
        if (record.value() == null) {
            // tombstone written by a redrive or purge
            log.debug("Skipping DLT tombstone for key {}", record.key());
            acknowledgment.acknowledge();
            return;
        }

        Headers headers = record.headers();
        String originalTopic = stringHeader(headers, KafkaHeaders.DLT_ORIGINAL_TOPIC, record.topic());
        int originalPartition = intHeader(headers, KafkaHeaders.DLT_ORIGINAL_PARTITION, record.partition());
        long originalOffset = longHeader(headers, KafkaHeaders.DLT_ORIGINAL_OFFSET, record.offset());
        String exceptionMessage = stringHeader(headers, KafkaHeaders.DLT_EXCEPTION_MESSAGE, "unknown");

        DeadLetterNotification.DeadLetterNotificationBuilder builder = DeadLetterNotification.builder()
                .id(UUID.randomUUID().toString())
                .originalKey(record.key())
                .originalTopic(originalTopic)
                .originalPartition(originalPartition)
                .originalOffset(originalOffset)
                .exceptionMessage(truncate(exceptionMessage, 2000))
                .payload(truncate(record.value(), MAX_PAYLOAD_LENGTH))
                .failedAt(OffsetDateTime.now(clock));

        try {
            JoinRequestedEvent event = objectMapper.readValue(record.value(), JoinRequestedEvent.class);
            builder.broadcastId(event.getBroadcastId()).requesterId(event.getRequesterId());
        } catch (JsonProcessingException e) {
            log.warn("DLT payload at {}-{}@{} is not a join request event: {}", originalTopic, originalPartition, originalOffset, e.getOriginalMessage());
        }

        DeadLetterNotification deadLetter = builder.build();
        try {
            deadLetterRepository.save(deadLetter);
            log.error("Dead-lettered join request event. Key: {}, Original: {}-{}@{}, Reason: {}",
                    record.key(), originalTopic, originalPartition, originalOffset, exceptionMessage);
        } catch (DataIntegrityViolationException e) {
            log.info("DLT record for {}-{}@{} already stored, ignoring redelivery", originalTopic, originalPartition, originalOffset);
        }
        acknowledgment.acknowledge();
    }

    private static String stringHeader(Headers headers, String name, String fallback) {
        Header header = headers.lastHeader(name);
        return header == null || header.value() == null ? fallback : new String(header.value(), StandardCharsets.UTF_8);
    }

    private static int intHeader(Headers headers, String name, int fallback) {
        Header header = headers.lastHeader(name);
        return header == null || header.value() == null || header.value().length < Integer.BYTES
                ? fallback : ByteBuffer.wrap(header.value()).getInt();
    }

    private static long longHeader(Headers headers, String name, long fallback) {
        Header header = headers.lastHeader(name);
        return header == null || header.value() == null || header.value().length < Long.BYTES
                ? fallback : ByteBuffer.wrap(header.value()).getLong();
    }

    private static String truncate(String value, int max) {
        return value != null && value.length() > max ? value.substring(0, max) : value;
    }
}
