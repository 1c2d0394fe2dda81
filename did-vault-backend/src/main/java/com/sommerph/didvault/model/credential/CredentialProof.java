package com.sommerph.didvault.model.credential;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CredentialProof {

    public static final String JWT_PROOF_TYPE = "JwtProof2020";

    private String type;

    // Compact ES256K JWT-VC
    private String jwt;

}
