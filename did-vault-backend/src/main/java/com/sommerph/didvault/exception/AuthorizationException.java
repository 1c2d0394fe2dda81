package com.sommerph.didvault.exception;

/**
 * Authenticated caller asked to act for an identity its session does not cover.
 */
public class AuthorizationException extends RuntimeException {

    public AuthorizationException(String message) {
        super(message);
    }

}
