package com.sommerph.didvault.model.credential;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One issuance event. Identities and ids only, never claim values.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class IssuanceAuditRecord {

    public static final String ACTION_ISSUED = "VC_ISSUED";

    private String timestamp;

    private String issuer;
    private String subject;

    private String credentialId;
    private List<String> types;

    private String action;

}
