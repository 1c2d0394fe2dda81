package com.sommerph.didvault.controller;

import com.sommerph.didvault.exception.AuthenticationException;
import com.sommerph.didvault.exception.ValidationException;
import com.sommerph.didvault.model.auth.Challenge;
import com.sommerph.didvault.model.auth.SessionToken;
import com.sommerph.didvault.service.auth.AuthenticationVerifier;
import com.sommerph.didvault.service.auth.ChallengeRegistry;
import com.sommerph.didvault.service.auth.SessionTokenService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
@Tag(name = "Authentication", description = "DID challenge-response login")
public class AuthController {

    private final ChallengeRegistry challengeRegistry;
    private final AuthenticationVerifier authenticationVerifier;
    private final SessionTokenService sessionTokenService;

    @Operation(summary = "Request a one-time challenge for a did:pkh identity")
    @GetMapping("/challenge")
    public ResponseEntity<?> requestChallenge(@RequestParam(name = "did", required = false) String did) {
        log.info("Challenge requested for {}", did);
        try {
            Challenge challenge = challengeRegistry.issue(did);
            return ResponseEntity.ok(new ChallengeResponse(challenge.getNonce(), challengeRegistry.getTtl().toSeconds()));
        } catch (ValidationException e) {
            return ResponseEntity.badRequest().body(new ErrorResponse(e.getMessage()));
        } catch (Exception e) {
            log.error("Failed to issue challenge for {}", did, e);
            return ResponseEntity.internalServerError().body(new ErrorResponse("Error issuing challenge"));
        }
    }

    @Operation(summary = "Exchange a signed challenge for a session token")
    @PostMapping("/verify-challenge")
    public ResponseEntity<?> verifyChallenge(@Valid @RequestBody VerifyChallengeRequest request) {
        log.info("Challenge response received for {}", request.getDid());
        try {
            SessionToken token = authenticationVerifier.verify(request.getDid(), request.getChallenge(), request.getSignature());
            return ResponseEntity.ok(new SessionResponse(token.getToken(), sessionTokenService.getTtl().toSeconds()));
        } catch (AuthenticationException e) {
            log.warn("Authentication failed for {}: {} ({})", request.getDid(), e.getReason(), e.getMessage());
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(new ErrorResponse(AuthenticationException.GENERIC_MESSAGE));
        } catch (ValidationException e) {
            return ResponseEntity.badRequest().body(new ErrorResponse(e.getMessage()));
        } catch (Exception e) {
            log.error("Failed to verify challenge for {}", request.getDid(), e);
            return ResponseEntity.internalServerError().body(new ErrorResponse("Error verifying challenge"));
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class VerifyChallengeRequest {
        @NotBlank
        @Pattern(regexp = "^did:pkh:eip155:\\d+:0x[a-fA-F0-9]{40}$", message = "must be a did:pkh:eip155 identifier")
        private String did;
        @NotBlank
        private String challenge;
        @NotBlank
        @Pattern(regexp = "^0x[a-fA-F0-9]{130}$", message = "must be a 65-byte 0x-prefixed hex signature")
        private String signature;
    }

    @Data
    @AllArgsConstructor
    public static class ChallengeResponse {
        private String challenge;
        private long expiresIn;
    }

    @Data
    @AllArgsConstructor
    public static class SessionResponse {
        private String sessionToken;
        private long expiresIn;
    }

}
