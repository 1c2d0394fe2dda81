package com.sommerph.didvault.model.revocation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Persisted revocation state, shared with out-of-band editors of {@code revoke.json}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RevocationList {

    private List<String> revokedCredentials = new ArrayList<>();

    private String lastUpdated;

    public static RevocationList empty() {
        return new RevocationList(new ArrayList<>(), null);
    }

}
