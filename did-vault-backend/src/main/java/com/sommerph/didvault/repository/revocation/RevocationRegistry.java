package com.sommerph.didvault.repository.revocation;

import com.sommerph.didvault.model.revocation.RevocationList;

/**
 * Append-only set of revoked credential ids.
 * <p>
 * Implementations must answer {@link #isRevoked(String)} from the current persisted
 * state on every call, so edits made outside this process take effect immediately.
 * No implementation may serve revocation checks from a long-lived cache.
 */
public interface RevocationRegistry {

    /**
     * Adds {@code credentialId} to the revoked set. Revoking an id twice is a no-op.
     *
     * @return true if the id was not revoked before this call
     * @throws IllegalArgumentException if {@code credentialId} is null or blank
     */
    boolean revoke(String credentialId);

    boolean isRevoked(String credentialId);

    RevocationList list();

    static String requireCredentialId(String credentialId) {
        if (credentialId == null || credentialId.isBlank()) {
            throw new IllegalArgumentException("Credential id must not be blank");
        }
        return credentialId;
    }

}
