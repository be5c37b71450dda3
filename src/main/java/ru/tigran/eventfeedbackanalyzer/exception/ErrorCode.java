package ru.tigran.eventfeedbackanalyzer.exception;

/**
 * Enum for application error codes.
 * Centralizes all error code definitions to avoid magic strings.
 * Each code has a default message for logging purposes.
 */
public enum ErrorCode {
    // Resource not found errors
    FORM_NOT_FOUND("FORM_NOT_FOUND", "Feedback form not found"),
    ANALYSIS_NOT_FOUND("ANALYSIS_NOT_FOUND", "Sentiment analysis not found"),

    // Client state errors
    NO_RESPONSES("NO_RESPONSES", "No feedback responses submitted yet"),

    // Validation errors
    VALIDATION_ERROR("VALIDATION_ERROR", "Validation failed"),
    INVALID_RATING("INVALID_RATING", "Rating must be between 1 and 5"),

    // AI service errors
    AI_SERVICE_UNAVAILABLE("AI_SERVICE_UNAVAILABLE", "External AI service unavailable"),

    // Storage errors
    STORAGE_ERROR("STORAGE_ERROR", "Database error occurred"),

    // Internal server errors
    INTERNAL_SERVER_ERROR("INTERNAL_SERVER_ERROR", "An unexpected error occurred");

    private final String code;
    private final String defaultMessage;

    ErrorCode(String code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
