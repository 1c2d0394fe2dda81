package com.sommerph.didvault.service.auth;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JOSEObjectType;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import com.sommerph.didvault.config.VaultProperties;
import com.sommerph.didvault.exception.FatalConfigurationException;
import com.sommerph.didvault.exception.SessionTokenException;
import com.sommerph.didvault.exception.SessionTokenException.Reason;
import com.sommerph.didvault.model.auth.SessionToken;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.UUID;

/**
 * HS256 bearer tokens that authorize credential issuance for exactly one subject.
 */
@Slf4j
@Service
public class SessionTokenService {

    public static final String TYPE_CLAIM = "type";
    public static final String SESSION_TYPE = "did-auth-session";

    private static final int MIN_SECRET_BYTES = 32;

    private final MACSigner signer;
    private final MACVerifier verifier;
    private final Duration ttl;
    private final Clock clock;

    public SessionTokenService(VaultProperties properties, Clock clock) {
        String secret = properties.getSession().getSecret();
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new FatalConfigurationException(
                    "Session secret must be configured with at least " + MIN_SECRET_BYTES + " bytes (vault.session.secret)");
        }
        try {
            byte[] key = secret.getBytes(StandardCharsets.UTF_8);
            this.signer = new MACSigner(key);
            this.verifier = new MACVerifier(key);
        } catch (JOSEException e) {
            throw new FatalConfigurationException("Session secret is not usable for HS256", e);
        }
        this.ttl = properties.getSession().getTtl();
        this.clock = clock;
    }

    public SessionToken mint(String subjectId) {
        log.info("Mint session token for subject {}", subjectId);
        Instant issuedAt = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant expiresAt = issuedAt.plus(ttl);

        JWTClaimsSet claims = new JWTClaimsSet.Builder()
                .subject(subjectId)
                .issueTime(Date.from(issuedAt))
                .expirationTime(Date.from(expiresAt))
                .jwtID(UUID.randomUUID().toString())
                .claim(TYPE_CLAIM, SESSION_TYPE)
                .build();
        SignedJWT jwt = new SignedJWT(new JWSHeader.Builder(JWSAlgorithm.HS256).type(JOSEObjectType.JWT).build(), claims);
        try {
            jwt.sign(signer);
        } catch (JOSEException e) {
            log.error("Failed to sign session token for subject {}", subjectId, e);
            throw new IllegalStateException("Session token signing failed", e);
        }
        return new SessionToken(jwt.serialize(), subjectId, issuedAt, expiresAt);
    }

    /**
     * @return the subject the token was minted for
     * @throws SessionTokenException if the token is unsigned, forged, expired or of another kind
     */
    public String validate(String token) {
        if (token == null || token.isBlank()) {
            throw new SessionTokenException(Reason.MALFORMED, "Missing session token");
        }
        SignedJWT jwt;
        JWTClaimsSet claims;
        try {
            jwt = SignedJWT.parse(token);
            claims = jwt.getJWTClaimsSet();
        } catch (ParseException e) {
            throw new SessionTokenException(Reason.MALFORMED, "Session token is not a signed JWT", e);
        }
        if (!JWSAlgorithm.HS256.equals(jwt.getHeader().getAlgorithm())) {
            throw new SessionTokenException(Reason.MALFORMED, "Unexpected session token algorithm " + jwt.getHeader().getAlgorithm());
        }
        try {
            if (!jwt.verify(verifier)) {
                throw new SessionTokenException(Reason.INVALID_SIGNATURE, "Session token signature does not verify");
            }
        } catch (JOSEException e) {
            throw new SessionTokenException(Reason.MALFORMED, "Session token could not be verified", e);
        }

        Date expiration = claims.getExpirationTime();
        if (expiration == null) {
            throw new SessionTokenException(Reason.MALFORMED, "Session token has no expiry");
        }
        if (!clock.instant().isBefore(expiration.toInstant())) {
            throw new SessionTokenException(Reason.EXPIRED, "Session token expired at " + expiration.toInstant());
        }
        if (!SESSION_TYPE.equals(claims.getClaim(TYPE_CLAIM))) {
            throw new SessionTokenException(Reason.WRONG_TYPE, "Token is not a session token");
        }
        String subject = claims.getSubject();
        if (subject == null || subject.isBlank()) {
            throw new SessionTokenException(Reason.MALFORMED, "Session token has no subject");
        }
        return subject;
    }

    public Duration getTtl() {
        return ttl;
    }

}
