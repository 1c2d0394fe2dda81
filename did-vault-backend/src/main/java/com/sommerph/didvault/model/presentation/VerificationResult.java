package com.sommerph.didvault.model.presentation;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VerificationResult {

    public static final String INVALID_FORMAT = "invalid presentation format";
    public static final String INVALID_PROOF = "invalid proof";
    public static final String MALFORMED_CREDENTIAL = "malformed credential";
    public static final String CREDENTIAL_REVOKED = "credential revoked";
    public static final String CREDENTIAL_EXPIRED = "credential expired";
    public static final String INVALID_CREDENTIAL_PROOF = "invalid credential proof";
    public static final String SUBJECT_MISMATCH = "credential subject mismatch";
    public static final String PRESENTATION_VERIFIED = "valid presentation with all credentials verified";
    public static final String CREDENTIAL_VERIFIED = "valid credential";

    private boolean verified;

    private String reason;

    private String credentialId;

    private Integer credentialCount;

    private String expirationDate;

    public static VerificationResult success(String reason, Integer credentialCount) {
        return new VerificationResult(true, reason, null, credentialCount, null);
    }

    public static VerificationResult failure(String reason) {
        return new VerificationResult(false, reason, null, null, null);
    }

    public static VerificationResult failure(String reason, String credentialId) {
        return new VerificationResult(false, reason, credentialId, null, null);
    }

}
