package ru.tigran.eventfeedbackanalyzer.exception;

/**
 * Thrown when the Gemini API call fails (HTTP error, timeout, open circuit, unreadable envelope).
 * HTTP status: 503 Service Unavailable
 *
 * Never retried: the failure is surfaced to the caller as is.
 */
public class AIGatewayException extends ApplicationException {
    public AIGatewayException(String message, String errorCode) {
        super(message, errorCode);
    }

    public AIGatewayException(String message, String errorCode, Throwable cause) {
        super(message, errorCode, cause);
    }
}
