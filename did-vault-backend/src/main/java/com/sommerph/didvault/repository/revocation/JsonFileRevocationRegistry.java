package com.sommerph.didvault.repository.revocation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.sommerph.didvault.model.revocation.RevocationList;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;

/**
 * Revocation list kept in a single JSON file. Every read goes to disk; a missing or
 * unreadable file counts as an empty list.
 */
@Slf4j
public class JsonFileRevocationRegistry implements RevocationRegistry {

    private final Path storageFile;
    private final ObjectMapper mapper;
    private final Clock clock;

    public JsonFileRevocationRegistry(String path, Clock clock) throws IOException {
        this.storageFile = Paths.get(path).toAbsolutePath();
        Files.createDirectories(storageFile.getParent());
        this.mapper = new ObjectMapper();
        this.mapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.clock = clock;
    }

    @Override
    public synchronized boolean revoke(String credentialId) {
        RevocationRegistry.requireCredentialId(credentialId);
        log.info("Revoke credential {}", credentialId);
        RevocationList current = read();
        if (current.getRevokedCredentials().contains(credentialId)) {
            log.info("Credential {} already revoked", credentialId);
            return false;
        }
        current.getRevokedCredentials().add(credentialId);
        current.setLastUpdated(clock.instant().toString());
        write(current);
        return true;
    }

    @Override
    public boolean isRevoked(String credentialId) {
        return credentialId != null && read().getRevokedCredentials().contains(credentialId);
    }

    @Override
    public RevocationList list() {
        return read();
    }

    private RevocationList read() {
        if (!Files.exists(storageFile)) {
            return RevocationList.empty();
        }
        try {
            RevocationList list = mapper.readValue(storageFile.toFile(), RevocationList.class);
            if (list == null) {
                return RevocationList.empty();
            }
            if (list.getRevokedCredentials() == null) {
                list.setRevokedCredentials(new ArrayList<>());
            }
            return list;
        } catch (IOException e) {
            log.warn("Revocation file {} is unreadable, treating it as empty: {}", storageFile, e.getMessage());
            return RevocationList.empty();
        }
    }

    private void write(RevocationList list) {
        try {
            Path temp = Files.createTempFile(storageFile.getParent(), storageFile.getFileName().toString(), ".tmp");
            mapper.writeValue(temp.toFile(), list);
            try {
                Files.move(temp, storageFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move unsupported for {}, falling back to replace", storageFile);
                Files.move(temp, storageFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            log.error("Failed to write revocation file {}", storageFile, e);
            throw new RuntimeException("Failed to persist revocation list: " + storageFile, e);
        }
    }

}
