package ru.tigran.eventfeedbackanalyzer.exception;

/**
 * Thrown when a feedback form or its analysis does not exist.
 * HTTP status: 404 Not Found
 */
public class ResourceNotFoundException extends ApplicationException {
    public ResourceNotFoundException(String message, String errorCode) {
        super(message, errorCode);
    }
}
