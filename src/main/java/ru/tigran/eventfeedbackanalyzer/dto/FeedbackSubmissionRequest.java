package ru.tigran.eventfeedbackanalyzer.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Request DTO для отправки отзыва участника.
 *
 * Constraints:
 * - attendeeName: Опциональное, до 255 символов
 * - rating: Обязательное, целое число от 1 до 5
 * - comment: Опциональное, до 2000 символов (строка из одних пробелов считается отсутствующей)
 */
public record FeedbackSubmissionRequest(
        @Size(max = 255, message = "Attendee name must be at most 255 characters")
        String attendeeName,

        @NotNull(message = "Rating is required")
        @Min(value = 1, message = "Rating must be between 1 and 5")
        @Max(value = 5, message = "Rating must be between 1 and 5")
        Integer rating,

        @Size(max = 2000, message = "Comment must be at most 2000 characters")
        String comment
) {
}
