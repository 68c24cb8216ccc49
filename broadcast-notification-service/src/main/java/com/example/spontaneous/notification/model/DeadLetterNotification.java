package com.example.spontaneous.notification.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.domain.Persistable;
import org.springframework.data.relational.core.mapping.Table;

import java.time.OffsetDateTime;

/**
 * A join-request event that exhausted its retries. {@code payload} is the raw record value
 * so it can be redriven even when it never deserialized.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("dead_letter_notifications")
public class DeadLetterNotification implements Persistable<String> {
    @Id
    private String id;
    private String originalKey;
    private String broadcastId;
    private String requesterId;
    private String originalTopic;
    private int originalPartition;
    private long originalOffset;
    private String exceptionMessage;
    private String payload;
    private OffsetDateTime failedAt;

    @Override
    @Transient
    @JsonIgnore
    public boolean isNew() {
        // ids are assigned before saving, so always insert
        return true;
    }
}
