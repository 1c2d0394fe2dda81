package com.sommerph.didvault.service.holder;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sommerph.didvault.exception.WrongPassphraseOrCorruptedException;
import com.sommerph.didvault.model.credential.VerifiableCredential;
import com.sommerph.didvault.model.vault.EncryptedCredential;
import lombok.extern.slf4j.Slf4j;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Passphrase encryption of credentials at rest: PBKDF2-HMAC-SHA256 key derivation and
 * AES-256-GCM. Salt and IV are fresh for every encryption.
 */
@Slf4j
public class VaultCodec {

    public static final int PBKDF2_ITERATIONS = 310_000;
    public static final int SALT_LENGTH = 16;
    public static final int IV_LENGTH = 12;
    private static final int KEY_LENGTH_BITS = 256;
    private static final int TAG_LENGTH_BITS = 128;
    private static final String KDF_ALGORITHM = "PBKDF2WithHmacSHA256";
    private static final String CIPHER_ALGORITHM = "AES/GCM/NoPadding";

    private final SecureRandom secureRandom = new SecureRandom();
    private final ObjectMapper mapper = new ObjectMapper();

    public SecretKey deriveKey(char[] passphrase, byte[] salt) throws GeneralSecurityException {
        PBEKeySpec spec = new PBEKeySpec(passphrase, salt, PBKDF2_ITERATIONS, KEY_LENGTH_BITS);
        try {
            byte[] keyBytes = SecretKeyFactory.getInstance(KDF_ALGORITHM).generateSecret(spec).getEncoded();
            return new SecretKeySpec(keyBytes, "AES");
        } finally {
            spec.clearPassword();
        }
    }

    public EncryptedCredential encrypt(VerifiableCredential credential, String passphrase) {
        if (passphrase == null || passphrase.isEmpty()) {
            throw new IllegalArgumentException("Passphrase must not be empty");
        }
        byte[] salt = randomBytes(SALT_LENGTH);
        byte[] iv = randomBytes(IV_LENGTH);
        try {
            byte[] plaintext = mapper.writeValueAsBytes(credential);
            Cipher cipher = Cipher.getInstance(CIPHER_ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, deriveKey(passphrase.toCharArray(), salt), new GCMParameterSpec(TAG_LENGTH_BITS, iv));
            byte[] cipherText = cipher.doFinal(plaintext);
            return new EncryptedCredential(
                    credential.getId(),
                    Base64.getEncoder().encodeToString(cipherText),
                    Base64.getEncoder().encodeToString(salt),
                    Base64.getEncoder().encodeToString(iv),
                    null
            );
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Credential cannot be serialized", e);
        } catch (GeneralSecurityException e) {
            log.error("Failed to encrypt credential {}", credential.getId(), e);
            throw new IllegalStateException("Credential encryption failed", e);
        }
    }

    /**
     * Returns the credential as read back from its JSON form. It serializes to the same JSON
     * as the credential that was encrypted, but claim values come back as Jackson's default
     * types ({@code Integer} or {@code Long} for integers, {@code Double} for decimals,
     * {@code Map} and {@code List} for nested values).
     *
     * @throws WrongPassphraseOrCorruptedException for any failure, whatever its cause
     */
    public VerifiableCredential decrypt(String cipherText, String passphrase, String salt, String iv) {
        if (cipherText == null || passphrase == null || salt == null || iv == null) {
            throw new WrongPassphraseOrCorruptedException();
        }
        try {
            byte[] saltBytes = Base64.getDecoder().decode(salt);
            byte[] ivBytes = Base64.getDecoder().decode(iv);
            if (saltBytes.length != SALT_LENGTH || ivBytes.length != IV_LENGTH) {
                throw new WrongPassphraseOrCorruptedException();
            }
            Cipher cipher = Cipher.getInstance(CIPHER_ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, deriveKey(passphrase.toCharArray(), saltBytes), new GCMParameterSpec(TAG_LENGTH_BITS, ivBytes));
            byte[] plaintext = cipher.doFinal(Base64.getDecoder().decode(cipherText));
            return mapper.readValue(plaintext, VerifiableCredential.class);
        } catch (GeneralSecurityException | IOException | IllegalArgumentException e) {
            log.debug("Vault entry could not be opened: {}", e.getClass().getSimpleName());
            throw new WrongPassphraseOrCorruptedException();
        }
    }

    public VerifiableCredential decrypt(EncryptedCredential entry, String passphrase) {
        return decrypt(entry.getCipherText(), passphrase, entry.getSalt(), entry.getIv());
    }

    private byte[] randomBytes(int length) {
        byte[] bytes = new byte[length];
        secureRandom.nextBytes(bytes);
        return bytes;
    }

}
