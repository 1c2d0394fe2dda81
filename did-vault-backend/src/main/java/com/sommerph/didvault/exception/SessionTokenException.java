package com.sommerph.didvault.exception;

import lombok.Getter;

@Getter
public class SessionTokenException extends RuntimeException {

    public enum Reason {
        EXPIRED,
        MALFORMED,
        WRONG_TYPE,
        INVALID_SIGNATURE
    }

    private final Reason reason;

    public SessionTokenException(Reason reason, String detail) {
        super(detail);
        this.reason = reason;
    }

    public SessionTokenException(Reason reason, String detail, Throwable cause) {
        super(detail, cause);
        this.reason = reason;
    }

}
