package com.sommerph.didvault.repository.revocation;

import com.sommerph.didvault.model.revocation.RevocationList;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
public class InMemoryRevocationRegistry implements RevocationRegistry {

    // id -> revocation time in millis, orders list()
    private final Map<String, Long> revocationStore = new ConcurrentHashMap<>();
    private final Clock clock;
    private volatile String lastUpdated;

    public InMemoryRevocationRegistry(Clock clock) {
        this.clock = clock;
    }

    @Override
    public boolean revoke(String credentialId) {
        RevocationRegistry.requireCredentialId(credentialId);
        log.info("Revoke credential {}", credentialId);
        boolean added = revocationStore.putIfAbsent(credentialId, clock.millis()) == null;
        if (added) {
            lastUpdated = clock.instant().toString();
        }
        return added;
    }

    @Override
    public boolean isRevoked(String credentialId) {
        return credentialId != null && revocationStore.containsKey(credentialId);
    }

    @Override
    public RevocationList list() {
        ArrayList<Map.Entry<String, Long>> entries = new ArrayList<>(revocationStore.entrySet());
        entries.sort(Map.Entry.comparingByValue());
        ArrayList<String> ids = new ArrayList<>();
        entries.forEach(e -> ids.add(e.getKey()));
        return new RevocationList(ids, lastUpdated);
    }

}
