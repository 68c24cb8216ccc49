package com.example.spontaneous.notification.service;

import com.example.spontaneous.notification.dto.RedriveAllResult;
import com.example.spontaneous.notification.dto.RedriveFailureDetail;
import com.example.spontaneous.notification.model.DeadLetterNotification;
import com.example.spontaneous.notification.repository.DeadLetterNotificationRepository;
import com.example.spontaneous.shared.dto.JoinRequestedEvent;
import com.example.spontaneous.shared.exception.InvalidBroadcastInputException;
import com.example.spontaneous.shared.exception.ResourceNotFoundException;
import com.example.spontaneous.shared.util.Constants;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;

/**
 * Administration of recorded dead letters: list, send back to the main topic, or discard.
 * Every removal also writes a tombstone for the record's key to the dead-letter topic.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DltService {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final DeadLetterNotificationRepository deadLetterRepository;

    public List<DeadLetterNotification> getDeadLetters() {
        return deadLetterRepository.findAllByOrderByFailedAtDesc();
    }

    /**
     * Sends one dead letter back to its original topic. Runs without a transaction: the
     * record is only deleted after both sends succeeded, and a failed delete leaves a
     * record that can be redriven again.
     */
    public void redrive(String id) {
        DeadLetterNotification deadLetter = findOrThrow(id);

        JoinRequestedEvent event;
        try {
            event = objectMapper.readValue(deadLetter.getPayload(), JoinRequestedEvent.class);
        } catch (JsonProcessingException e) {
            throw new InvalidBroadcastInputException("Dead letter " + id + " does not hold a join request event and cannot be redriven");
        }

        log.info("Redriving dead letter {} back to topic {}", id, deadLetter.getOriginalTopic());
        try {
            kafkaTemplate.send(deadLetter.getOriginalTopic(), event.getBroadcastId(), event).get();
            kafkaTemplate.send(dltTopicOf(deadLetter), deadLetter.getOriginalKey(), null).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while redriving dead letter " + id, e);
        } catch (ExecutionException e) {
            log.error("Failed to redrive dead letter {}. It stays recorded.", id, e);
            throw new IllegalStateException("Failed to send dead letter " + id + " to Kafka", e.getCause());
        }

        deadLetterRepository.deleteById(id);
        log.info("Redrove and removed dead letter {}", id);
    }

    public RedriveAllResult redriveAll() {
        List<DeadLetterNotification> deadLetters = getDeadLetters();
        if (deadLetters.isEmpty()) {
            log.info("No dead letters to redrive.");
            return RedriveAllResult.builder().totalMessages(0).successCount(0).failureCount(0).failures(new ArrayList<>()).build();
        }

        log.info("Attempting to redrive all {} dead letters.", deadLetters.size());
        int successCount = 0;
        List<RedriveFailureDetail> failures = new ArrayList<>();
        for (DeadLetterNotification deadLetter : deadLetters) {
            try {
                redrive(deadLetter.getId());
                successCount++;
            } catch (RuntimeException e) {
                failures.add(new RedriveFailureDetail(deadLetter.getId(), e.getMessage()));
                log.error("Failed to redrive dead letter {}. Reason: {}", deadLetter.getId(), e.getMessage());
            }
        }

        log.info("Finished redriving dead letters. Success: {}, Failures: {}", successCount, failures.size());
        return RedriveAllResult.builder()
                .totalMessages(deadLetters.size())
                .successCount(successCount)
                .failureCount(failures.size())
                .failures(failures)
                .build();
    }

    @Transactional
    public void purge(String id) {
        DeadLetterNotification deadLetter = findOrThrow(id);
        sendTombstone(deadLetter);
        deadLetterRepository.deleteById(id);
        log.info("Purged dead letter {} and sent tombstone with key {}", id, deadLetter.getOriginalKey());
    }

    @Transactional
    public int purgeAll() {
        List<DeadLetterNotification> deadLetters = getDeadLetters();
        if (deadLetters.isEmpty()) {
            log.info("No dead letters to purge.");
            return 0;
        }
        for (DeadLetterNotification deadLetter : deadLetters) {
            sendTombstone(deadLetter);
        }
        deadLetterRepository.deleteAll(deadLetters);
        log.info("Purged all {} dead letters and sent tombstones.", deadLetters.size());
        return deadLetters.size();
    }

    private DeadLetterNotification findOrThrow(String id) {
        return deadLetterRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Dead letter not found with ID: " + id));
    }

    private void sendTombstone(DeadLetterNotification deadLetter) {
        String dltTopic = dltTopicOf(deadLetter);
        kafkaTemplate.send(dltTopic, deadLetter.getOriginalKey(), null)
                .whenComplete((result, ex) -> {
                    if (ex != null) {
                        log.warn("Tombstone for dead letter {} (key {}) on {} was not written: {}",
                                deadLetter.getId(), deadLetter.getOriginalKey(), dltTopic, ex.getMessage());
                    }
                });
    }

    private static String dltTopicOf(DeadLetterNotification deadLetter) {
        return deadLetter.getOriginalTopic() + Constants.DLT_SUFFIX;
    }
}
