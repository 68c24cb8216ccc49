package com.example.spontaneous.lifecycle.dto;

import com.example.spontaneous.shared.util.Constants.JoinRequestStatus;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class JoinDecisionRequest {

    @NotNull(message = "Decision status is required")
    private JoinRequestStatus status;
}
