package ru.tigran.eventfeedbackanalyzer.exception;

/**
 * Thrown for business logic validation failures.
 * Examples: rating outside 1-5, blank event name on update.
 * HTTP status: 400 Bad Request
 */
public class ValidationException extends ApplicationException {
    public ValidationException(String message, String errorCode) {
        super(message, errorCode);
    }
}
