package ru.tigran.eventfeedbackanalyzer.dto;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

public record FeedbackFormResponse(
        UUID id,
        String eventName,
        LocalDate eventDate,
        String description,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
}
