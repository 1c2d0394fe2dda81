package com.sommerph.didvault.repository.vault;

import com.sommerph.didvault.model.vault.EncryptedCredential;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
public class InMemoryVaultStore implements VaultStore {

    private final Map<String, EncryptedCredential> vaultStore = new ConcurrentHashMap<>();

    @Override
    public void save(EncryptedCredential entry) {
        log.info("Save vault entry {}", entry.getVcId());
        vaultStore.put(entry.getVcId(), entry);
    }

    @Override
    public EncryptedCredential load(String vcId) {
        log.info("Load vault entry {}", vcId);
        return vaultStore.get(vcId);
    }

    @Override
    public List<EncryptedCredential> list() {
        return new ArrayList<>(vaultStore.values());
    }

    @Override
    public boolean delete(String vcId) {
        return vaultStore.remove(vcId) != null;
    }

    @Override
    public boolean exists(String vcId) {
        return vaultStore.containsKey(vcId);
    }

}
