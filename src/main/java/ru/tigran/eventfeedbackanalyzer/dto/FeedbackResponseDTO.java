package ru.tigran.eventfeedbackanalyzer.dto;

import java.time.LocalDateTime;
import java.util.UUID;

public record FeedbackResponseDTO(
        UUID id,
        UUID formId,
        String attendeeName,
        Integer rating,
        String comment,
        LocalDateTime submittedAt
) {
}
