package com.sommerph.didvault.service.holder;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sommerph.didvault.exception.WrongPassphraseOrCorruptedException;
import com.sommerph.didvault.model.credential.CredentialProof;
import com.sommerph.didvault.model.credential.VerifiableCredential;
import com.sommerph.didvault.model.vault.EncryptedCredential;
import com.sommerph.didvault.support.TestFixtures;
import org.junit.jupiter.api.Test;

import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

class VaultCodecTest {

    private final VaultCodec codec = new VaultCodec();

    static VerifiableCredential sampleCredential(String id) {
        return new VerifiableCredential(
                List.of(VerifiableCredential.W3C_CREDENTIALS_CONTEXT),
                id,
                List.of(VerifiableCredential.BASE_TYPE, "DocumentCredential"),
                TestFixtures.ISSUER_DID,
                "2026-03-01T10:00:00Z",
                "2027-03-01T10:00:00Z",
                Map.of("id", TestFixtures.HOLDER_DID, "documentHash", "0xabc"),
                new CredentialProof(CredentialProof.JWT_PROOF_TYPE, "header.payload.signature")
        );
    }

    @Test
    void decryptsWithSamePassphrase() {
        VerifiableCredential credential = sampleCredential("urn:uuid:1");

        EncryptedCredential entry = codec.encrypt(credential, "correct horse");

        assertThat(entry.getVcId()).isEqualTo("urn:uuid:1");
        assertThat(Base64.getDecoder().decode(entry.getSalt())).hasSize(VaultCodec.SALT_LENGTH);
        assertThat(Base64.getDecoder().decode(entry.getIv())).hasSize(VaultCodec.IV_LENGTH);
        assertThat(codec.decrypt(entry, "correct horse")).isEqualTo(credential);
    }

    @Test
    void saltAndIvAreFreshPerEncryption() {
        VerifiableCredential credential = sampleCredential("urn:uuid:1");

        EncryptedCredential first = codec.encrypt(credential, "pass");
        EncryptedCredential second = codec.encrypt(credential, "pass");

        assertThat(first.getSalt()).isNotEqualTo(second.getSalt());
        assertThat(first.getIv()).isNotEqualTo(second.getIv());
        assertThat(first.getCipherText()).isNotEqualTo(second.getCipherText());
    }

    @Test
    void wrongPassphraseAndTamperingFailTheSameWay() {
        EncryptedCredential entry = codec.encrypt(sampleCredential("urn:uuid:1"), "right");

        Throwable wrongPassphrase = catchThrowable(() -> codec.decrypt(entry, "wrong"));

        byte[] cipherText = Base64.getDecoder().decode(entry.getCipherText());
        cipherText[0] ^= 0x01;
        Throwable tampered = catchThrowable(() -> codec.decrypt(
                Base64.getEncoder().encodeToString(cipherText), "right", entry.getSalt(), entry.getIv()));

        assertThat(wrongPassphrase).isInstanceOf(WrongPassphraseOrCorruptedException.class);
        assertThat(tampered).isInstanceOf(WrongPassphraseOrCorruptedException.class);
        assertThat(tampered.getMessage()).isEqualTo(wrongPassphrase.getMessage());
    }

    @Test
    void malformedFieldsAreReportedAsCorrupted() {
        EncryptedCredential entry = codec.encrypt(sampleCredential("urn:uuid:1"), "right");

        assertThatThrownBy(() -> codec.decrypt(entry.getCipherText(), "right", "not base64!", entry.getIv()))
                .isInstanceOf(WrongPassphraseOrCorruptedException.class);
        assertThatThrownBy(() -> codec.decrypt(entry.getCipherText(), "right", entry.getSalt(), null))
                .isInstanceOf(WrongPassphraseOrCorruptedException.class);
        assertThatThrownBy(() -> codec.decrypt(entry.getCipherText(), "right", entry.getIv(), entry.getIv()))
                .isInstanceOf(WrongPassphraseOrCorruptedException.class);
    }

    @Test
    void emptyPassphraseIsRefusedForEncryption() {
        assertThatThrownBy(() -> codec.encrypt(sampleCredential("urn:uuid:1"), ""))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void numericClaimsSurviveAsTheSameJson() throws Exception {
        Map<String, Object> claims = new LinkedHashMap<>();
        claims.put("id", TestFixtures.HOLDER_DID);
        claims.put("serial", 9_007_199_254_740_993L);
        claims.put("smallCount", 3L);
        claims.put("score", 0.5f);
        claims.put("nested", Map.of("level", 2L, "ratio", 1.25d));
        VerifiableCredential credential = sampleCredential("urn:uuid:numbers");
        credential.setCredentialSubject(claims);

        VerifiableCredential restored = codec.decrypt(codec.encrypt(credential, "pass"), "pass");

        ObjectMapper mapper = new ObjectMapper();
        assertThat(mapper.writeValueAsString(restored)).isEqualTo(mapper.writeValueAsString(credential));
        assertThat(restored.getCredentialSubject().get("serial")).isEqualTo(9_007_199_254_740_993L);
        assertThat(restored.getCredentialSubject().get("smallCount")).isEqualTo(3);
        assertThat(restored.getCredentialSubject().get("score")).isEqualTo(0.5d);
    }

}
