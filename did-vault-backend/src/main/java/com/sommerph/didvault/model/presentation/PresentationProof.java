package com.sommerph.didvault.model.presentation;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PresentationProof {

    public static final String RECOVERY_SIGNATURE_TYPE = "EcdsaSecp256k1RecoverySignature2020";
    public static final String AUTHENTICATION_PURPOSE = "authentication";

    private String type;

    private String created;

    private String proofPurpose;

    // <holder DID>#controller
    private String verificationMethod;

    // 0x-hex EIP-191 signature over the canonical presentation without proof
    private String proofValue;

}
