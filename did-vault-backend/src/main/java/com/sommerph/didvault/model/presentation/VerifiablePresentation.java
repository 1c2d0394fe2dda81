package com.sommerph.didvault.model.presentation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"@context", "type", "holder", "verifiableCredential", "proof"})
public class VerifiablePresentation {

    public static final String BASE_TYPE = "VerifiablePresentation";

    @JsonProperty("@context")
    private List<String> context;

    private List<String> type;

    private String holder;

    private List<CredentialEnvelope> verifiableCredential;

    private PresentationProof proof;

}
