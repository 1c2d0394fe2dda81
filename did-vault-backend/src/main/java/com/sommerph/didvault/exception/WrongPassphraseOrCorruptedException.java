package com.sommerph.didvault.exception;

/**
 * Single failure for every vault decryption problem. Does not tell a wrong
 * passphrase apart from damaged ciphertext.
 */
public class WrongPassphraseOrCorruptedException extends RuntimeException {

    public static final String MESSAGE = "Wrong passphrase or corrupted vault entry";

    public WrongPassphraseOrCorruptedException() {
        super(MESSAGE);
    }

}
