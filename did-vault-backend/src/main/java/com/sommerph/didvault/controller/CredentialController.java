package com.sommerph.didvault.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.sommerph.didvault.exception.AuthenticationException;
import com.sommerph.didvault.exception.AuthorizationException;
import com.sommerph.didvault.exception.SessionTokenException;
import com.sommerph.didvault.exception.ValidationException;
import com.sommerph.didvault.model.credential.IssuedCredential;
import com.sommerph.didvault.model.presentation.VerificationResult;
import com.sommerph.didvault.service.credential.CredentialIssuer;
import com.sommerph.didvault.service.presentation.PresentationVerifier;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/credentials")
@RequiredArgsConstructor
@Tag(name = "Credentials", description = "Issuance and single-credential verification")
public class CredentialController {

    private static final String BEARER_PREFIX = "Bearer ";

    private final CredentialIssuer credentialIssuer;
    private final PresentationVerifier presentationVerifier;

    @Operation(summary = "Issue a verifiable credential to the authenticated subject")
    @PostMapping("/issue")
    public ResponseEntity<?> issueCredential(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                             @Valid @RequestBody IssueCredentialRequest request) {
        log.info("Credential requested for subject {}", request.getSubjectDid());
        if (authorization == null || !authorization.startsWith(BEARER_PREFIX)) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(new ErrorResponse("Missing bearer token"));
        }
        try {
            IssuedCredential issued = credentialIssuer.issue(
                    authorization.substring(BEARER_PREFIX.length()).trim(),
                    request.getSubjectDid(),
                    request.getCredentialSubject(),
                    request.getValidityDays());
            return ResponseEntity.status(HttpStatus.CREATED).body(issued);
        } catch (SessionTokenException e) {
            log.warn("Session rejected for issuance to {}: {} ({})", request.getSubjectDid(), e.getReason(), e.getMessage());
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(new ErrorResponse(AuthenticationException.GENERIC_MESSAGE));
        } catch (AuthorizationException e) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).body(new ErrorResponse(e.getMessage()));
        } catch (ValidationException e) {
            return ResponseEntity.badRequest().body(new ErrorResponse(e.getMessage()));
        } catch (Exception e) {
            log.error("Failed to issue credential for subject {}", request.getSubjectDid(), e);
            return ResponseEntity.internalServerError().body(new ErrorResponse("Error issuing credential"));
        }
    }

    @Operation(summary = "Verify a single credential given as JWT or credential object")
    @PostMapping("/verify")
    public ResponseEntity<VerificationResult> verifyCredential(@RequestBody VerifyCredentialRequest request) {
        if (request.getCredential() == null || request.getCredential().isNull()) {
            return ResponseEntity.badRequest().body(VerificationResult.failure(VerificationResult.MALFORMED_CREDENTIAL));
        }
        return ResponseEntity.ok(presentationVerifier.verifyCredential(request.getCredential()));
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class IssueCredentialRequest {
        @NotBlank
        private String subjectDid;
        @NotNull
        private Map<String, Object> credentialSubject;
        private Integer validityDays;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class VerifyCredentialRequest {
        private JsonNode credential;
    }

}
