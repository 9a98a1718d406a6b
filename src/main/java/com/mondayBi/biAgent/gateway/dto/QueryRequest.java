package com.mondayBi.biAgent.gateway.dto;

import com.mondayBi.biAgent.orchestrator.model.ConversationTurn;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Request DTO for business questions.
 * The caller owns the conversation history and sends it with every question.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class QueryRequest {

    @NotBlank(message = "message cannot be blank")
    private String message;

    private List<ConversationTurn> history = new ArrayList<>();
}
