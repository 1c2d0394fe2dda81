package com.sommerph.didvault.repository.vault;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.sommerph.didvault.model.vault.EncryptedCredential;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.util.encoders.Hex;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * One JSON file per encrypted credential, named by the lowercase hex of the credential
 * id's UTF-8 bytes, so distinct ids never share a file on any file system.
 */
@Slf4j
public class JsonFileVaultStore implements VaultStore {

    private static final String SUFFIX = "-vault-entry.json";

    private final Path storageDir;
    private final ObjectMapper mapper;

    public JsonFileVaultStore(String path) throws IOException {
        this.storageDir = Paths.get(path);
        Files.createDirectories(storageDir);
        this.mapper = new ObjectMapper();
        this.mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public void save(EncryptedCredential entry) {
        log.info("Save vault entry {}", entry.getVcId());
        try {
            mapper.writeValue(fileFor(entry.getVcId()).toFile(), entry);
        } catch (IOException e) {
            log.error("Failed to save vault entry: {}", entry.getVcId(), e);
            throw new RuntimeException("Failed to save vault entry: " + entry.getVcId(), e);
        }
    }

    @Override
    public EncryptedCredential load(String vcId) {
        log.info("Load vault entry {}", vcId);
        Path file = fileFor(vcId);
        if (!Files.exists(file)) {
            return null;
        }
        try {
            EncryptedCredential entry = mapper.readValue(file.toFile(), EncryptedCredential.class);
            if (!vcId.equals(entry.getVcId())) {
                throw new IllegalStateException("Vault file " + file.getFileName() + " holds " + entry.getVcId() + ", not " + vcId);
            }
            return entry;
        } catch (IOException e) {
            log.error("Failed to load vault entry: {}", vcId, e);
            throw new RuntimeException("Failed to load vault entry: " + vcId, e);
        }
    }

    @Override
    public List<EncryptedCredential> list() {
        List<EncryptedCredential> entries = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(storageDir, "*" + SUFFIX)) {
            for (Path file : files) {
                try {
                    entries.add(mapper.readValue(file.toFile(), EncryptedCredential.class));
                } catch (IOException e) {
                    log.warn("Skipping unreadable vault file {}: {}", file.getFileName(), e.getMessage());
                }
            }
        } catch (IOException e) {
            log.error("Failed to list vault directory {}", storageDir, e);
            throw new RuntimeException("Failed to list vault entries in " + storageDir, e);
        }
        return entries;
    }

    @Override
    public boolean delete(String vcId) {
        try {
            return Files.deleteIfExists(fileFor(vcId));
        } catch (IOException e) {
            log.error("Failed to delete vault entry: {}", vcId, e);
            throw new RuntimeException("Failed to delete vault entry: " + vcId, e);
        }
    }

    @Override
    public boolean exists(String vcId) {
        return Files.exists(fileFor(vcId));
    }

    private Path fileFor(String vcId) {
        if (vcId == null || vcId.isBlank()) {
            throw new IllegalArgumentException("Vault entry id must not be blank");
        }
        return storageDir.resolve(Hex.toHexString(vcId.getBytes(StandardCharsets.UTF_8)) + SUFFIX);
    }

}
