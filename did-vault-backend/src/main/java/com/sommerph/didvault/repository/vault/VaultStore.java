package com.sommerph.didvault.repository.vault;

import com.sommerph.didvault.model.vault.EncryptedCredential;

import java.util.List;

public interface VaultStore {

    void save(EncryptedCredential entry);

    EncryptedCredential load(String vcId);

    List<EncryptedCredential> list();

    boolean delete(String vcId);

    boolean exists(String vcId);

}
