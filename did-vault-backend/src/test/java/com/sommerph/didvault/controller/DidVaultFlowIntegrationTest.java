package com.sommerph.didvault.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sommerph.didvault.model.presentation.VerifiablePresentation;
import com.sommerph.didvault.service.holder.PresentationBuilder;
import com.sommerph.didvault.support.TestFixtures;
import com.sommerph.didvault.util.EthereumSignatures;
import com.sommerph.didvault.util.Secp256k1Keys;
import org.bitcoinj.core.ECKey;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class DidVaultFlowIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private Clock clock;

    private final ECKey holderKey = Secp256k1Keys.fromPrivateHex(TestFixtures.HOLDER_KEY);

    private JsonNode body(String json) throws Exception {
        return objectMapper.readTree(json);
    }

    private String login(String did, ECKey key) throws Exception {
        String challenge = body(mockMvc.perform(get("/api/auth/challenge").param("did", did))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.expiresIn").value(300))
                .andReturn().getResponse().getContentAsString()).get("challenge").asText();

        String response = mockMvc.perform(post("/api/auth/verify-challenge")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "did", did,
                                "challenge", challenge,
                                "signature", EthereumSignatures.signPersonalMessage(key, challenge)))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.expiresIn").value(600))
                .andReturn().getResponse().getContentAsString();
        return body(response).get("sessionToken").asText();
    }

    private JsonNode issue(String session, String subjectDid) throws Exception {
        String response = mockMvc.perform(post("/api/credentials/issue")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + session)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "subjectDid", subjectDid,
                                "credentialSubject", Map.of("documentHash", "0xfeed")))))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        return body(response);
    }

    private String presentationRequest(VerifiablePresentation presentation) throws Exception {
        ObjectNode request = objectMapper.createObjectNode();
        request.set("presentation", objectMapper.valueToTree(presentation));
        return objectMapper.writeValueAsString(request);
    }

    @Test
    void loginIssuePresentRevoke() throws Exception {
        String session = login(TestFixtures.HOLDER_DID, holderKey);
        JsonNode issued = issue(session, TestFixtures.HOLDER_DID);
        String credentialId = issued.get("id").asText();
        assertThat(credentialId).startsWith("urn:uuid:");
        assertThat(issued.at("/credential/issuer").asText()).isEqualTo(TestFixtures.ISSUER_DID);
        assertThat(issued.at("/credential/credentialSubject/id").asText()).isEqualTo(TestFixtures.HOLDER_DID);

        VerifiablePresentation presentation = new PresentationBuilder(clock)
                .buildFromJwts(TestFixtures.HOLDER_DID, holderKey, List.of(issued.get("jwt").asText()));
        String request = presentationRequest(presentation);

        mockMvc.perform(post("/api/presentations/verify").contentType(MediaType.APPLICATION_JSON).content(request))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.verified").value(true))
                .andExpect(jsonPath("$.credentialCount").value(1));

        mockMvc.perform(post("/api/revocations")
                        .header(RevocationController.ADMIN_TOKEN_HEADER, "test-admin-token")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"credentialId\":\"" + credentialId + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.revoked").value(true))
                .andExpect(jsonPath("$.newlyRevoked").value(true));

        mockMvc.perform(get("/api/revocations"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.revokedCredentials", hasItem(credentialId)));

        mockMvc.perform(post("/api/presentations/verify").contentType(MediaType.APPLICATION_JSON).content(request))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.verified").value(false))
                .andExpect(jsonPath("$.reason").value("credential revoked"))
                .andExpect(jsonPath("$.credentialId").value(credentialId));
    }

    @Test
    void singleCredentialVerification() throws Exception {
        JsonNode issued = issue(login(TestFixtures.HOLDER_DID, holderKey), TestFixtures.HOLDER_DID);
        ObjectNode request = objectMapper.createObjectNode();
        request.set("credential", issued.get("credential"));

        mockMvc.perform(post("/api/credentials/verify").contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.verified").value(true))
                .andExpect(jsonPath("$.credentialId").value(issued.get("id").asText()));
    }

    @Test
    void replayedChallengeIsUnauthorizedWithGenericMessage() throws Exception {
        String challenge = body(mockMvc.perform(get("/api/auth/challenge").param("did", TestFixtures.OTHER_DID))
                .andReturn().getResponse().getContentAsString()).get("challenge").asText();
        String signed = objectMapper.writeValueAsString(Map.of(
                "did", TestFixtures.OTHER_DID,
                "challenge", challenge,
                "signature", EthereumSignatures.signPersonalMessage(Secp256k1Keys.fromPrivateHex(TestFixtures.OTHER_KEY), challenge)));

        mockMvc.perform(post("/api/auth/verify-challenge").contentType(MediaType.APPLICATION_JSON).content(signed))
                .andExpect(status().isOk());
        mockMvc.perform(post("/api/auth/verify-challenge").contentType(MediaType.APPLICATION_JSON).content(signed))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Authentication failed"));
    }

    @Test
    void malformedIdentityIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/auth/challenge").param("did", "did:web:example.com"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(post("/api/auth/verify-challenge").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"did\":\"nope\",\"challenge\":\"x\",\"signature\":\"0x00\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void issuanceNeedsMatchingSession() throws Exception {
        String body = objectMapper.writeValueAsString(Map.of(
                "subjectDid", TestFixtures.OTHER_DID,
                "credentialSubject", Map.of("k", "v")));

        mockMvc.perform(post("/api/credentials/issue").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isUnauthorized());
        mockMvc.perform(post("/api/credentials/issue")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer not-a-token")
                        .contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isUnauthorized());

        String holderSession = login(TestFixtures.HOLDER_DID, holderKey);
        mockMvc.perform(post("/api/credentials/issue")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + holderSession)
                        .contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isForbidden());
        mockMvc.perform(post("/api/credentials/issue")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + holderSession)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "subjectDid", TestFixtures.HOLDER_DID,
                                "credentialSubject", Map.of("id", TestFixtures.OTHER_DID)))))
                .andExpect(status().isBadRequest());
    }

    @Test
    void revocationRequiresAdminToken() throws Exception {
        mockMvc.perform(post("/api/revocations").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"credentialId\":\"urn:uuid:no-token\"}"))
                .andExpect(status().isUnauthorized());
        mockMvc.perform(post("/api/revocations")
                        .header(RevocationController.ADMIN_TOKEN_HEADER, "wrong")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"credentialId\":\"urn:uuid:no-token\"}"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void missingPresentationIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/presentations/verify").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.reason").value("invalid presentation format"));
    }

}
