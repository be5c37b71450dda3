package ru.tigran.eventfeedbackanalyzer.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;

/**
 * Request DTO для создания формы обратной связи.
 *
 * Constraints:
 * - eventName: Обязательное поле, 1-255 символов
 * - eventDate: Опциональное поле (ISO-8601, например 2026-06-15)
 * - description: Опциональное поле, до 2000 символов
 */
public record FeedbackFormRequest(
        @NotBlank(message = "Event name must not be blank")
        @Size(max = 255, message = "Event name must be at most 255 characters")
        String eventName,

        LocalDate eventDate,

        @Size(max = 2000, message = "Description must be at most 2000 characters")
        String description
) {
}
