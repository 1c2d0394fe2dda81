package com.sommerph.didvault.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.sommerph.didvault.model.presentation.VerificationResult;
import com.sommerph.didvault.service.presentation.PresentationVerifier;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@Slf4j
@RestController
@RequestMapping("/api/presentations")
@RequiredArgsConstructor
@Tag(name = "Presentations", description = "Verifiable presentation verification")
public class PresentationController {

    private final PresentationVerifier presentationVerifier;

    @Operation(summary = "Verify a presentation and screen its credentials for revocation and expiry")
    @PostMapping("/verify")
    public ResponseEntity<VerificationResult> verifyPresentation(@RequestBody VerifyPresentationRequest request) {
        if (request.getPresentation() == null || !request.getPresentation().isObject()) {
            log.info("Verification request without a presentation object");
            return ResponseEntity.badRequest().body(VerificationResult.failure(VerificationResult.INVALID_FORMAT));
        }
        return ResponseEntity.ok(presentationVerifier.verify(request.getPresentation()));
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class VerifyPresentationRequest {
        private JsonNode presentation;
    }

}
