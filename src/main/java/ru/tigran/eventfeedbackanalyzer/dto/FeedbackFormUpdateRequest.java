package ru.tigran.eventfeedbackanalyzer.dto;

import jakarta.validation.constraints.Size;

import java.time.LocalDate;

/**
 * Partial update of a form. A null field means "not supplied" and leaves the stored value as is.
 */
public record FeedbackFormUpdateRequest(
        @Size(min = 1, max = 255, message = "Event name must be 1-255 characters")
        String eventName,

        LocalDate eventDate,

        @Size(max = 2000, message = "Description must be at most 2000 characters")
        String description
) {
}
