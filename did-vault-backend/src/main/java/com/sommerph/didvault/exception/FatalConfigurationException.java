package com.sommerph.didvault.exception;

/**
 * Thrown during startup when signing material is missing or unusable.
 */
public class FatalConfigurationException extends RuntimeException {

    public FatalConfigurationException(String message) {
        super(message);
    }

    public FatalConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

}
