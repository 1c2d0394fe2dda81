package com.sommerph.didvault.config;

import com.sommerph.didvault.repository.challenge.ChallengeStore;
import com.sommerph.didvault.repository.challenge.InMemoryChallengeStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ChallengeStoreConfig {

    @Value("${vault.challenge.store.type:memory}")
    private String storeType;

    @Bean
    public ChallengeStore challengeStore() {
        return switch (storeType.toLowerCase()) {
            case "memory" -> new InMemoryChallengeStore();
            default -> throw new IllegalArgumentException("Unsupported challenge store type: " + storeType);
        };
    }

}
