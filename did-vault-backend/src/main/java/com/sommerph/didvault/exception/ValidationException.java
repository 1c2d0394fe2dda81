package com.sommerph.didvault.exception;

/**
 * Client input that cannot be processed: bad identity, signature or claim shape.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

}
