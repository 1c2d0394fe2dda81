package com.sommerph.didvault.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "vault")
public class VaultProperties {

    private Issuer issuer = new Issuer();
    private Session session = new Session();
    private Challenge challenge = new Challenge();
    private Verifier verifier = new Verifier();

    @Data
    public static class Issuer {
        // secp256k1 private key, hex with or without 0x prefix
        private String privateKey;
        private long chainId = 1;
        private String credentialType = "DocumentCredential";
        private int defaultValidityDays = 365;
        private int maxValidityDays = 3650;
    }

    @Data
    public static class Session {
        private String secret;
        private Duration ttl = Duration.ofMinutes(10);
    }

    @Data
    public static class Challenge {
        private Duration ttl = Duration.ofMinutes(5);
        private Duration sweepInterval = Duration.ofSeconds(60);
    }

    @Data
    public static class Verifier {
        // Empty means any issuer whose JWT key matches its did:pkh address
        private List<String> trustedIssuers = new ArrayList<>();
    }

}
