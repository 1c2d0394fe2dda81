package com.sommerph.didvault.exception;

import lombok.Getter;

/**
 * Failed proof of key possession. The reason is for logs only; callers outside the
 * service must see {@link #GENERIC_MESSAGE}.
 */
@Getter
public class AuthenticationException extends RuntimeException {

    public static final String GENERIC_MESSAGE = "Authentication failed";

    public enum Reason {
        CHALLENGE_NOT_FOUND,
        CHALLENGE_EXPIRED,
        CHALLENGE_MISMATCH,
        INVALID_SIGNATURE,
        ADDRESS_MISMATCH
    }

    private final Reason reason;

    public AuthenticationException(Reason reason, String detail) {
        super(detail);
        this.reason = reason;
    }

    public AuthenticationException(Reason reason, String detail, Throwable cause) {
        super(detail, cause);
        this.reason = reason;
    }

}
