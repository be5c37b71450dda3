package ru.tigran.eventfeedbackanalyzer.exception;

/**
 * Base exception class for all application-specific exceptions.
 * Carries an error code from {@link ErrorCode} so the boundary layer can report
 * a stable machine-readable reason next to the human-readable message.
 */
public abstract class ApplicationException extends RuntimeException {
    private final String errorCode;

    public ApplicationException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public ApplicationException(String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
