package ru.tigran.eventfeedbackanalyzer.exception;

/**
 * Thrown when analysis is requested for a form that exists but has no responses yet.
 * HTTP status: 422 Unprocessable Entity
 */
public class NoResponsesException extends ApplicationException {
    public NoResponsesException(String message, String errorCode) {
        super(message, errorCode);
    }
}
