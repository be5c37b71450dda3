package ru.tigran.eventfeedbackanalyzer.exception;

/**
 * Error body returned by {@link GlobalExceptionHandler}.
 */
public record ErrorResponse(String code, String message) {
}
