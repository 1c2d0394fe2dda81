package com.sommerph.didvault.service.auth;

import com.sommerph.didvault.config.VaultProperties;
import com.sommerph.didvault.exception.AuthenticationException;
import com.sommerph.didvault.exception.AuthenticationException.Reason;
import com.sommerph.didvault.model.auth.Challenge;
import com.sommerph.didvault.model.auth.DidPkh;
import com.sommerph.didvault.repository.challenge.ChallengeStore;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.util.encoders.Hex;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Single-use login nonces, one pending per identity. A new challenge for an identity
 * replaces the pending one (last writer wins).
 */
@Slf4j
@Service
public class ChallengeRegistry {

    private static final int NONCE_BYTES = 32;

    private final ChallengeStore store;
    private final Clock clock;
    private final Duration ttl;
    private final SecureRandom random = new SecureRandom();

    public ChallengeRegistry(ChallengeStore store, Clock clock, VaultProperties properties) {
        this.store = store;
        this.clock = clock;
        this.ttl = properties.getChallenge().getTtl();
    }

    public Challenge issue(String subjectId) {
        DidPkh.parse(subjectId);
        Instant now = clock.instant();
        Challenge challenge = new Challenge(subjectId, newNonce(now), now, now.plus(ttl), false);
        Challenge replaced = store.put(challenge);
        if (replaced != null) {
            log.info("Replaced pending challenge for subject {}", subjectId);
        }
        log.info("Issued challenge for subject {}, expires at {}", subjectId, challenge.getExpiresAt());
        return challenge;
    }

    /**
     * Removes and returns the pending challenge if {@code nonce} matches it exactly.
     *
     * @throws AuthenticationException with reason CHALLENGE_NOT_FOUND, CHALLENGE_EXPIRED or CHALLENGE_MISMATCH
     */
    public Challenge consume(String subjectId, String nonce) {
        Challenge pending = store.get(subjectId);
        if (pending == null) {
            throw new AuthenticationException(Reason.CHALLENGE_NOT_FOUND, "No pending challenge for " + subjectId);
        }
        if (pending.isExpiredAt(clock.instant())) {
            store.remove(subjectId, pending);
            throw new AuthenticationException(Reason.CHALLENGE_EXPIRED, "Challenge for " + subjectId + " expired at " + pending.getExpiresAt());
        }
        if (nonce == null || !MessageDigest.isEqual(
                pending.getNonce().getBytes(StandardCharsets.UTF_8), nonce.getBytes(StandardCharsets.UTF_8))) {
            throw new AuthenticationException(Reason.CHALLENGE_MISMATCH, "Challenge does not match pending one for " + subjectId);
        }
        if (!store.remove(subjectId, pending)) {
            // lost a race with another consumer or a newer issue
            throw new AuthenticationException(Reason.CHALLENGE_NOT_FOUND, "Challenge for " + subjectId + " was already used");
        }
        return new Challenge(pending.getSubjectId(), pending.getNonce(), pending.getIssuedAt(), pending.getExpiresAt(), true);
    }

    @Scheduled(fixedDelayString = "${vault.challenge.sweep-interval:PT60S}")
    public void sweepExpired() {
        int removed = store.sweep(clock.instant());
        if (removed > 0) {
            log.info("Swept {} expired challenges, {} pending", removed, store.size());
        }
    }

    public Duration getTtl() {
        return ttl;
    }

    private String newNonce(Instant now) {
        byte[] bytes = new byte[NONCE_BYTES];
        random.nextBytes(bytes);
        return Hex.toHexString(bytes) + "-" + now.toEpochMilli();
    }

}
