package com.sommerph.didvault.config;

import com.sommerph.didvault.repository.audit.InMemoryIssuanceAuditLog;
import com.sommerph.didvault.repository.audit.IssuanceAuditLog;
import com.sommerph.didvault.repository.audit.JsonLinesIssuanceAuditLog;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;

@Configuration
public class IssuanceAuditLogConfig {

    @Value("${vault.audit.type}")
    private String auditType;

    @Value("${vault.audit.path}")
    private String auditPath;

    @Bean
    public IssuanceAuditLog issuanceAuditLog() throws IOException {
        return switch (auditType.toLowerCase()) {
            case "json" -> new JsonLinesIssuanceAuditLog(auditPath);
            case "memory" -> new InMemoryIssuanceAuditLog();
            default -> throw new IllegalArgumentException("Unsupported audit log type: " + auditType);
        };
    }

}
