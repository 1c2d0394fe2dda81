package com.sommerph.didvault.controller;

import com.sommerph.didvault.repository.revocation.RevocationRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/revocations")
@Tag(name = "Revocation", description = "Revocation list maintenance")
public class RevocationController {

    public static final String ADMIN_TOKEN_HEADER = "X-Admin-Token";

    private final RevocationRegistry revocationRegistry;
    private final String adminToken;

    public RevocationController(RevocationRegistry revocationRegistry,
                                @Value("${vault.revocation.admin-token:}") String adminToken) {
        this.revocationRegistry = revocationRegistry;
        this.adminToken = adminToken;
    }

    @Operation(summary = "Get the current revocation list")
    @GetMapping
    public ResponseEntity<?> listRevocations() {
        try {
            return ResponseEntity.ok(revocationRegistry.list());
        } catch (Exception e) {
            log.error("Failed to read revocation list", e);
            return ResponseEntity.internalServerError().body(new ErrorResponse("Error reading revocation list"));
        }
    }

    @Operation(summary = "Revoke a credential by id")
    @PostMapping
    public ResponseEntity<?> revoke(@RequestHeader(value = ADMIN_TOKEN_HEADER, required = false) String token,
                                    @Valid @RequestBody RevokeRequest request) {
        if (adminToken == null || adminToken.isBlank()) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).body(new ErrorResponse("Revocation endpoint is disabled"));
        }
        if (token == null || !MessageDigest.isEqual(
                adminToken.getBytes(StandardCharsets.UTF_8), token.getBytes(StandardCharsets.UTF_8))) {
            log.warn("Rejected revocation request for {}", request.getCredentialId());
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(new ErrorResponse("Invalid admin token"));
        }
        try {
            boolean newlyRevoked = revocationRegistry.revoke(request.getCredentialId());
            return ResponseEntity.ok(new RevokeResponse(request.getCredentialId(), true, newlyRevoked));
        } catch (Exception e) {
            log.error("Failed to revoke credential {}", request.getCredentialId(), e);
            return ResponseEntity.internalServerError().body(new ErrorResponse("Error revoking credential"));
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RevokeRequest {
        @NotBlank
        private String credentialId;
    }

    @Data
    @AllArgsConstructor
    public static class RevokeResponse {
        private String credentialId;
        private boolean revoked;
        private boolean newlyRevoked;
    }

}
