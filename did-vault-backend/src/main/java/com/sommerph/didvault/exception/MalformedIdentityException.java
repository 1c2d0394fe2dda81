package com.sommerph.didvault.exception;

public class MalformedIdentityException extends ValidationException {

    public MalformedIdentityException(String identity) {
        super("Malformed identity: " + identity);
    }

}
