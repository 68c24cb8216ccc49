package com.example.spontaneous.lifecycle.service;

import com.example.spontaneous.shared.config.AppProperties;
import com.example.spontaneous.shared.config.MonitoringConfig;
import com.example.spontaneous.shared.dto.JoinRequestedEvent;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.KafkaException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JoinRequestNotificationPublisherTest {

    private static final String TOPIC = "join-request-notifications";

    @Mock
    private KafkaTemplate<String, Object> kafkaTemplate;

    private MonitoringConfig.BroadcastMetricsCollector metricsCollector;
    private JoinRequestNotificationPublisher publisher;

    @BeforeEach
    void setUp() {
        metricsCollector = new MonitoringConfig.BroadcastMetricsCollector(new SimpleMeterRegistry());
        publisher = new JoinRequestNotificationPublisher(kafkaTemplate, new AppProperties(), metricsCollector);
    }

    @Test
    void publish_sendsEventKeyedByBroadcastId() {
        JoinRequestedEvent event = new JoinRequestedEvent("7", "bob");
        RecordMetadata metadata = new RecordMetadata(new TopicPartition(TOPIC, 1), 0L, 0, 0L, 0, 0);
        when(kafkaTemplate.send(TOPIC, "7", event))
                .thenReturn(CompletableFuture.completedFuture(new SendResult<>(new ProducerRecord<>(TOPIC, "7", event), metadata)));

        publisher.publish(event);

        verify(kafkaTemplate).send(TOPIC, "7", event);
        assertThat(metricsCollector.getCounterValue(MonitoringConfig.NOTIFICATIONS_PUBLISHED, "status", "success")).isEqualTo(1);
    }

    @Test
    void publish_asyncSendFailureIsCountedNotThrown() {
        JoinRequestedEvent event = new JoinRequestedEvent("7", "bob");
        when(kafkaTemplate.send(anyString(), anyString(), any()))
                .thenReturn(CompletableFuture.failedFuture(new KafkaException("broker down")));

        assertThatCode(() -> publisher.publish(event)).doesNotThrowAnyException();
        assertThat(metricsCollector.getCounterValue(MonitoringConfig.NOTIFICATIONS_PUBLISHED, "status", "failed")).isEqualTo(1);
    }

    @Test
    void publish_synchronousSendFailureIsSwallowed() {
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenThrow(new KafkaException("metadata timeout"));

        assertThatCode(() -> publisher.publish(new JoinRequestedEvent("7", "bob"))).doesNotThrowAnyException();
        assertThat(metricsCollector.getCounterValue(MonitoringConfig.NOTIFICATIONS_PUBLISHED, "status", "failed")).isEqualTo(1);
    }
}
