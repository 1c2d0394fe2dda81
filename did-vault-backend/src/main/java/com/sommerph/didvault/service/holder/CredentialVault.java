package com.sommerph.didvault.service.holder;

import com.sommerph.didvault.exception.WrongPassphraseOrCorruptedException;
import com.sommerph.didvault.model.credential.VerifiableCredential;
import com.sommerph.didvault.model.vault.EncryptedCredential;
import com.sommerph.didvault.repository.vault.VaultStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Holder's encrypted credential store. Listing is tolerant: entries that cannot be
 * opened with the given passphrase are skipped and left untouched.
 */
@Slf4j
@RequiredArgsConstructor
public class CredentialVault {

    private final VaultStore store;
    private final VaultCodec codec;
    private final Clock clock;

    public EncryptedCredential store(VerifiableCredential credential, String passphrase) {
        if (credential.getId() == null || credential.getId().isBlank()) {
            throw new IllegalArgumentException("Credential has no id");
        }
        log.info("Store credential {} in vault", credential.getId());
        EncryptedCredential entry = codec.encrypt(credential, passphrase);
        entry.setStoredAt(clock.instant().toString());
        store.save(entry);
        return entry;
    }

    public VerifiableCredential load(String vcId, String passphrase) {
        EncryptedCredential entry = store.load(vcId);
        if (entry == null) {
            throw new IllegalArgumentException("No vault entry for " + vcId);
        }
        return codec.decrypt(entry, passphrase);
    }

    public List<VerifiableCredential> listAll(String passphrase) {
        List<EncryptedCredential> entries = store.list();
        List<VerifiableCredential> credentials = new ArrayList<>();
        for (EncryptedCredential entry : entries) {
            try {
                credentials.add(codec.decrypt(entry, passphrase));
            } catch (WrongPassphraseOrCorruptedException e) {
                log.warn("Skipping vault entry {}: {}", entry.getVcId(), e.getMessage());
            }
        }
        log.info("Opened {} of {} vault entries", credentials.size(), entries.size());
        return credentials;
    }

    public boolean remove(String vcId) {
        log.info("Remove credential {} from vault", vcId);
        return store.delete(vcId);
    }

}
