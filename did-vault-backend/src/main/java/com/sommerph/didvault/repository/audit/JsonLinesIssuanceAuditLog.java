package com.sommerph.didvault.repository.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sommerph.didvault.model.credential.IssuanceAuditRecord;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only audit file, one JSON object per line.
 */
@Slf4j
public class JsonLinesIssuanceAuditLog implements IssuanceAuditLog {

    private final Path logFile;
    private final ObjectMapper mapper;

    public JsonLinesIssuanceAuditLog(String path) throws IOException {
        this.logFile = Paths.get(path).toAbsolutePath();
        Files.createDirectories(logFile.getParent());
        this.mapper = new ObjectMapper();
    }

    @Override
    public synchronized void append(IssuanceAuditRecord record) {
        log.info("Audit {} of {} for subject {}", record.getAction(), record.getCredentialId(), record.getSubject());
        try {
            String line = mapper.writeValueAsString(record) + System.lineSeparator();
            Files.writeString(logFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            log.error("Failed to append issuance audit record for {}", record.getCredentialId(), e);
            throw new RuntimeException("Failed to write issuance audit record: " + record.getCredentialId(), e);
        }
    }

    @Override
    public List<IssuanceAuditRecord> readAll() {
        if (!Files.exists(logFile)) {
            return List.of();
        }
        try {
            List<IssuanceAuditRecord> records = new ArrayList<>();
            for (String line : Files.readAllLines(logFile, StandardCharsets.UTF_8)) {
                if (line.isBlank()) continue;
                records.add(mapper.readValue(line, IssuanceAuditRecord.class));
            }
            return records;
        } catch (IOException e) {
            log.error("Failed to read issuance audit log {}", logFile, e);
            throw new RuntimeException("Failed to read issuance audit log: " + logFile, e);
        }
    }

}
