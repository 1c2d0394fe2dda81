package com.sommerph.didvault.model.credential;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * W3C VC data model 1.1 credential with an inline JWT proof.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"@context", "id", "type", "issuer", "issuanceDate", "expirationDate", "credentialSubject", "proof"})
public class VerifiableCredential {

    public static final String W3C_CREDENTIALS_CONTEXT = "https://www.w3.org/2018/credentials/v1";
    public static final String BASE_TYPE = "VerifiableCredential";

    @JsonProperty("@context")
    private List<String> context;

    // urn:uuid:..., the revocation key
    private String id;

    private List<String> type;

    private String issuer;

    private String issuanceDate;
    private String expirationDate;

    // always carries "id" = subject DID
    private Map<String, Object> credentialSubject;

    private CredentialProof proof;

}
