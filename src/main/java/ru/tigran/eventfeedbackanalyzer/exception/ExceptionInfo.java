package ru.tigran.eventfeedbackanalyzer.exception;

import org.springframework.http.HttpStatus;

/**
 * Internal class used by GlobalExceptionHandler to map exception types to HTTP status codes
 * and logging levels.
 */
record ExceptionInfo(HttpStatus status, boolean shouldLogError) {
    /**
     * Returns ExceptionInfo for given ApplicationException type.
     *
     * @param exception ApplicationException instance
     * @return ExceptionInfo with status and logging configuration
     */
    static ExceptionInfo forException(ApplicationException exception) {
        if (exception instanceof ResourceNotFoundException) {
            return new ExceptionInfo(HttpStatus.NOT_FOUND, false);
        } else if (exception instanceof ValidationException) {
            return new ExceptionInfo(HttpStatus.BAD_REQUEST, false);
        } else if (exception instanceof NoResponsesException) {
            return new ExceptionInfo(HttpStatus.UNPROCESSABLE_ENTITY, false);
        } else if (exception instanceof AIGatewayException) {
            return new ExceptionInfo(HttpStatus.SERVICE_UNAVAILABLE, true);
        } else if (exception instanceof StorageException) {
            return new ExceptionInfo(HttpStatus.INTERNAL_SERVER_ERROR, true);
        }
        // Default for unknown ApplicationException subtypes
        return new ExceptionInfo(HttpStatus.INTERNAL_SERVER_ERROR, true);
    }
}
