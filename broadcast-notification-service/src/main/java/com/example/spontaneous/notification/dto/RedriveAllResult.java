package com.example.spontaneous.notification.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RedriveAllResult {
    private int totalMessages;
    private int successCount;
    private int failureCount;
    private List<RedriveFailureDetail> failures;
}
