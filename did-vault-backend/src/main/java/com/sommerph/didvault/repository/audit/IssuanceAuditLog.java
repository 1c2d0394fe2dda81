package com.sommerph.didvault.repository.audit;

import com.sommerph.didvault.model.credential.IssuanceAuditRecord;

import java.util.List;

public interface IssuanceAuditLog {

    void append(IssuanceAuditRecord record);

    List<IssuanceAuditRecord> readAll();

}
