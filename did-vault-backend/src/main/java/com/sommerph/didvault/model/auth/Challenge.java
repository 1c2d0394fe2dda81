package com.sommerph.didvault.model.auth;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Challenge {

    private String subjectId;

    private String nonce;

    private Instant issuedAt;
    private Instant expiresAt;

    private boolean consumed;

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }

}
