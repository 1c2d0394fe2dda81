package com.sommerph.didvault.config;

import com.sommerph.didvault.repository.revocation.InMemoryRevocationRegistry;
import com.sommerph.didvault.repository.revocation.JsonFileRevocationRegistry;
import com.sommerph.didvault.repository.revocation.RevocationRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.time.Clock;

@Configuration
public class RevocationRegistryConfig {

    @Value("${vault.revocation.registry.type}")
    private String registryType;

    @Value("${vault.revocation.storage.path}")
    private String storagePath;

    @Bean
    public RevocationRegistry revocationRegistry(Clock clock) throws IOException {
        return switch (registryType.toLowerCase()) {
            case "json" -> new JsonFileRevocationRegistry(storagePath, clock);
            case "memory" -> new InMemoryRevocationRegistry(clock);
            default -> throw new IllegalArgumentException("Unsupported registry type: " + registryType);
        };
    }

}
