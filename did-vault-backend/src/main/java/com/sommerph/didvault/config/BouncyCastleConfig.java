package com.sommerph.didvault.config;

import com.sommerph.didvault.util.Secp256k1Keys;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class BouncyCastleConfig {

    @PostConstruct
    public void registerProvider() {
        Secp256k1Keys.ensureProvider();
        log.info("BouncyCastle provider registered for secp256k1 operations");
    }
}
