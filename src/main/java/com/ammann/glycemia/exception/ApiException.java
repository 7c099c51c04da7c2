package com.ammann.glycemia.exception;

/**
 * Base unchecked exception for all application-level errors in the glycemic variability processor.
 *
 * <p>Subclasses represent specific error categories (invalid arguments, unknown indices,
 * internal errors) and are mapped to appropriate HTTP status codes by
 * {@link GlobalExceptionHandler}.
 */
public class ApiException extends RuntimeException
{
    public ApiException(String message, Throwable cause) {
        super(message, cause);
    }
    public ApiException(String message) {
        super(message);
    }
}
