package com.example.spontaneous.notification.service;

import com.example.spontaneous.notification.model.DeadLetterNotification;
import com.example.spontaneous.notification.repository.DeadLetterNotificationRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.kafka.support.KafkaHeaders;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DeadLetterConsumerServiceTest {

    private static final OffsetDateTime NOW = OffsetDateTime.of(2025, 3, 1, 12, 0, 0, 0, ZoneOffset.UTC);
    private static final String DLT = "join-request-notifications-dlt";

    @Mock
    private DeadLetterNotificationRepository deadLetterRepository;
    @Mock
    private Acknowledgment acknowledgment;

    private DeadLetterConsumerService service;

    @BeforeEach
    void setUp() {
        service = new DeadLetterConsumerService(deadLetterRepository, new ObjectMapper(),
                Clock.fixed(NOW.toInstant(), ZoneOffset.UTC));
    }

    @Test
    void onDeadLetter_recordsOriginCoordinatesAndEventFields() {
        ConsumerRecord<String, String> record = deadLetter("{\"broadcastId\":\"7\",\"requesterId\":\"bob\"}");

        service.onDeadLetter(record, acknowledgment);

        ArgumentCaptor<DeadLetterNotification> saved = ArgumentCaptor.forClass(DeadLetterNotification.class);
        verify(deadLetterRepository).save(saved.capture());
        DeadLetterNotification deadLetter = saved.getValue();
        assertThat(deadLetter.getId()).isNotBlank();
        assertThat(deadLetter.getOriginalKey()).isEqualTo("7");
        assertThat(deadLetter.getOriginalTopic()).isEqualTo("join-request-notifications");
        assertThat(deadLetter.getOriginalPartition()).isEqualTo(2);
        assertThat(deadLetter.getOriginalOffset()).isEqualTo(451L);
        assertThat(deadLetter.getExceptionMessage()).isEqualTo("push gateway down");
        assertThat(deadLetter.getBroadcastId()).isEqualTo("7");
        assertThat(deadLetter.getRequesterId()).isEqualTo("bob");
        assertThat(deadLetter.getFailedAt()).isEqualTo(NOW);
        verify(acknowledgment).acknowledge();
    }

    @Test
    void onDeadLetter_keepsUnparseablePayloadVerbatim() {
        ConsumerRecord<String, String> record = deadLetter("{not json");

        service.onDeadLetter(record, acknowledgment);

        ArgumentCaptor<DeadLetterNotification> saved = ArgumentCaptor.forClass(DeadLetterNotification.class);
        verify(deadLetterRepository).save(saved.capture());
        assertThat(saved.getValue().getPayload()).isEqualTo("{not json");
        assertThat(saved.getValue().getBroadcastId()).isNull();
        verify(acknowledgment).acknowledge();
    }

    @Test
    void onDeadLetter_redeliveredRecordIsIgnored() {
        when(deadLetterRepository.save(any(DeadLetterNotification.class)))
                .thenThrow(new DuplicateKeyException("uq_dead_letter_notifications_origin"));

        service.onDeadLetter(deadLetter("{\"broadcastId\":\"7\",\"requesterId\":\"bob\"}"), acknowledgment);

        verify(acknowledgment).acknowledge();
    }

    @Test
    void onDeadLetter_skipsTombstones() {
        service.onDeadLetter(new ConsumerRecord<>(DLT, 0, 3L, "7", null), acknowledgment);

        verifyNoInteractions(deadLetterRepository);
        verify(acknowledgment).acknowledge();
    }

    @Test
    void onDeadLetter_missingHeadersFallBackToRecordCoordinates() {
        ConsumerRecord<String, String> record = new ConsumerRecord<>(DLT, 0, 9L, "7", "{\"broadcastId\":\"7\",\"requesterId\":\"bob\"}");

        service.onDeadLetter(record, acknowledgment);

        ArgumentCaptor<DeadLetterNotification> saved = ArgumentCaptor.forClass(DeadLetterNotification.class);
        verify(deadLetterRepository).save(saved.capture());
        assertThat(saved.getValue().getOriginalTopic()).isEqualTo(DLT);
        assertThat(saved.getValue().getOriginalOffset()).isEqualTo(9L);
        assertThat(saved.getValue().getExceptionMessage()).isEqualTo("unknown");
    }

    private static ConsumerRecord<String, String> deadLetter(String payload) {
        ConsumerRecord<String, String> record = new ConsumerRecord<>(DLT, 0, 17L, "7", payload);
        record.headers().add(KafkaHeaders.DLT_ORIGINAL_TOPIC, "join-request-notifications".getBytes(StandardCharsets.UTF_8));
        record.headers().add(KafkaHeaders.DLT_ORIGINAL_PARTITION, ByteBuffer.allocate(Integer.BYTES).putInt(2).array());
        record.headers().add(KafkaHeaders.DLT_ORIGINAL_OFFSET, ByteBuffer.allocate(Long.BYTES).putLong(451L).array());
        record.headers().add(KafkaHeaders.DLT_EXCEPTION_MESSAGE, "push gateway down".getBytes(StandardCharsets.UTF_8));
        return record;
    }
}
