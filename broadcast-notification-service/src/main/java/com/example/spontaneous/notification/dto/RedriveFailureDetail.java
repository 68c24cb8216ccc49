package com.example.spontaneous.notification.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RedriveFailureDetail {
    private String id;
    private String reason;
}
