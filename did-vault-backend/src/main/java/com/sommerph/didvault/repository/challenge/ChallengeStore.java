package com.sommerph.didvault.repository.challenge;

import com.sommerph.didvault.model.auth.Challenge;

import java.time.Instant;

/**
 * Pending challenges keyed by subject id, at most one per subject.
 */
public interface ChallengeStore {

    Challenge get(String subjectId);

    /** Stores the challenge, replacing and returning any previous one for the subject. */
    Challenge put(Challenge challenge);

    /** Removes the entry only if it is still {@code expected}. */
    boolean remove(String subjectId, Challenge expected);

    /** Drops every entry expired at {@code now} and returns how many were removed. */
    int sweep(Instant now);

    int size();

}
