package com.sommerph.didvault.repository.audit;

import com.sommerph.didvault.model.credential.IssuanceAuditRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

@Slf4j
public class InMemoryIssuanceAuditLog implements IssuanceAuditLog {

    private final List<IssuanceAuditRecord> records = new CopyOnWriteArrayList<>();

    @Override
    public void append(IssuanceAuditRecord record) {
        log.info("Audit {} of {} for subject {}", record.getAction(), record.getCredentialId(), record.getSubject());
        records.add(record);
    }

    @Override
    public List<IssuanceAuditRecord> readAll() {
        return List.copyOf(records);
    }

}
