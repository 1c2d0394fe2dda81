package com.sommerph.didvault.model.auth;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SessionToken {

    // Compact HS256 JWT
    private String token;

    private String subjectId;

    private Instant issuedAt;
    private Instant expiresAt;

}
