package ru.tigran.eventfeedbackanalyzer.exception;

/**
 * Thrown when the entity store rejects an operation in a way the caller cannot resolve.
 * HTTP status: 500 Internal Server Error
 */
public class StorageException extends ApplicationException {
    public StorageException(String message, String errorCode, Throwable cause) {
        super(message, errorCode, cause);
    }
}
