package com.sommerph.didvault.service.presentation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.crypto.ECDSAVerifier;
import com.nimbusds.jose.jwk.Curve;
import com.nimbusds.jose.jwk.ECKey;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jwt.SignedJWT;
import com.sommerph.didvault.config.VaultProperties;
import com.sommerph.didvault.exception.MalformedIdentityException;
import com.sommerph.didvault.model.auth.DidPkh;
import com.sommerph.didvault.model.presentation.CredentialEnvelope;
import com.sommerph.didvault.model.presentation.PresentationProof;
import com.sommerph.didvault.model.presentation.VerifiablePresentation;
import com.sommerph.didvault.model.presentation.VerificationResult;
import com.sommerph.didvault.repository.revocation.RevocationRegistry;
import com.sommerph.didvault.service.credential.IssuerKeyService;
import com.sommerph.didvault.util.EthereumSignatures;
import com.sommerph.didvault.util.PresentationSigning;
import com.sommerph.didvault.util.Secp256k1Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.security.SignatureException;
import java.security.interfaces.ECPublicKey;
import java.text.ParseException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Checks a presentation and every credential in it. Never throws: each outcome,
 * including malformed input, is reported as a {@link VerificationResult}.
 * <p>
 * Order of checks: structure, holder proof, then per credential (in list order)
 * id, revocation, expiry, issuer signature and subject binding. The first failure
 * wins. Revocations that land while a presentation is being checked only affect the
 * credentials not yet screened.
 * <p>
 * Only issuers listed in {@code vault.verifier.trusted-issuers} are accepted. When the
 * list is empty, the one trusted issuer is this service's own issuer DID.
 */
@Slf4j
@Service
public class PresentationVerifier {

    static final String VERIFICATION_ERROR = "verification error";

    private final RevocationRegistry revocationRegistry;
    private final Clock clock;
    private final List<String> trustedIssuers;
    private final ObjectMapper mapper = new ObjectMapper();

    public PresentationVerifier(RevocationRegistry revocationRegistry, Clock clock, VaultProperties properties,
                                IssuerKeyService issuerKeyService) {
        this.revocationRegistry = revocationRegistry;
        this.clock = clock;
        List<String> configured = properties.getVerifier().getTrustedIssuers();
        this.trustedIssuers = configured == null || configured.isEmpty()
                ? List.of(issuerKeyService.getIssuerDid())
                : List.copyOf(configured);
        log.info("Trusted credential issuers: {}", trustedIssuers);
    }

    public VerificationResult verify(VerifiablePresentation presentation) {
        return verify(presentation == null ? null : mapper.valueToTree(presentation));
    }

    public VerificationResult verify(JsonNode presentation) {
        try {
            VerificationResult result = verifyPresentation(presentation);
            log.info("Presentation verification finished: verified={}, reason={}", result.isVerified(), result.getReason());
            return result;
        } catch (RuntimeException e) {
            log.error("Unexpected failure while verifying presentation", e);
            return VerificationResult.failure(VERIFICATION_ERROR);
        }
    }

    /** Checks a single credential (JWT string or credential object) without a holder binding. */
    public VerificationResult verifyCredential(JsonNode credential) {
        try {
            CredentialEnvelope envelope;
            try {
                envelope = CredentialEnvelope.fromJson(credential);
            } catch (IllegalArgumentException e) {
                return VerificationResult.failure(VerificationResult.MALFORMED_CREDENTIAL);
            }
            VerificationResult failure = screen(envelope, null);
            if (failure != null) {
                return failure;
            }
            String id = envelope.credentialId().orElse(null);
            log.info("Credential {} verified", id);
            return new VerificationResult(true, VerificationResult.CREDENTIAL_VERIFIED, id, null, null);
        } catch (RuntimeException e) {
            log.error("Unexpected failure while verifying credential", e);
            return VerificationResult.failure(VERIFICATION_ERROR);
        }
    }

    private VerificationResult verifyPresentation(JsonNode node) {
        if (node == null || !node.isObject() || !hasPresentationType(node.get("type"))) {
            return VerificationResult.failure(VerificationResult.INVALID_FORMAT);
        }
        JsonNode list = node.get("verifiableCredential");
        if (list == null || !list.isArray() || list.isEmpty()) {
            return VerificationResult.failure(VerificationResult.INVALID_FORMAT);
        }
        JsonNode holderNode = node.get("holder");
        if (holderNode == null || !holderNode.isTextual() || !DidPkh.isValid(holderNode.asText())) {
            return VerificationResult.failure(VerificationResult.INVALID_FORMAT);
        }
        List<CredentialEnvelope> credentials = new ArrayList<>();
        for (JsonNode item : list) {
            try {
                credentials.add(CredentialEnvelope.fromJson(item));
            } catch (IllegalArgumentException e) {
                return VerificationResult.failure(VerificationResult.INVALID_FORMAT);
            }
        }

        DidPkh holder = DidPkh.parse(holderNode.asText());
        if (!holderProofValid(node, holder)) {
            log.warn("Holder proof rejected for {}", holder);
            return VerificationResult.failure(VerificationResult.INVALID_PROOF);
        }

        for (CredentialEnvelope credential : credentials) {
            VerificationResult failure = screen(credential, holder);
            if (failure != null) {
                return failure;
            }
        }
        return VerificationResult.success(VerificationResult.PRESENTATION_VERIFIED, credentials.size());
    }

    private boolean hasPresentationType(JsonNode type) {
        if (type == null) return false;
        if (type.isTextual()) return VerifiablePresentation.BASE_TYPE.equals(type.asText());
        if (type.isArray()) {
            for (JsonNode t : type) {
                if (VerifiablePresentation.BASE_TYPE.equals(t.asText())) return true;
            }
        }
        return false;
    }

    private boolean holderProofValid(JsonNode presentation, DidPkh holder) {
        JsonNode proof = presentation.get("proof");
        if (proof == null || !proof.isObject()) {
            return false;
        }
        if (!PresentationProof.RECOVERY_SIGNATURE_TYPE.equals(proof.path("type").asText())) {
            return false;
        }
        JsonNode method = proof.get("verificationMethod");
        if (method != null && !sameIdentity(method.asText().split("#", 2)[0], holder)) {
            return false;
        }
        try {
            String signer = EthereumSignatures.recoverAddress(
                    PresentationSigning.signingInput(presentation), proof.path("proofValue").asText(null));
            return EthereumSignatures.sameAddress(signer, holder.getAddress());
        } catch (SignatureException e) {
            log.warn("Holder signature unusable: {}", e.getMessage());
            return false;
        }
    }

    /**
     * @return the failure for this credential, or null if it passes
     */
    private VerificationResult screen(CredentialEnvelope credential, DidPkh holder) {
        Optional<String> id = credential.credentialId();
        if (id.isEmpty()) {
            return VerificationResult.failure(VerificationResult.MALFORMED_CREDENTIAL);
        }
        String credentialId = id.get();
        if (revocationRegistry.isRevoked(credentialId)) {
            log.warn("Credential {} is revoked", credentialId);
            return VerificationResult.failure(VerificationResult.CREDENTIAL_REVOKED, credentialId);
        }

        Optional<Instant> expiresAt;
        try {
            expiresAt = credential.expiresAt();
        } catch (IllegalArgumentException e) {
            log.warn("Credential {} has an unreadable expiry: {}", credentialId, e.getMessage());
            return VerificationResult.failure(VerificationResult.MALFORMED_CREDENTIAL, credentialId);
        }
        if (expiresAt.isPresent() && !clock.instant().isBefore(expiresAt.get())) {
            log.warn("Credential {} expired at {}", credentialId, expiresAt.get());
            return new VerificationResult(false, VerificationResult.CREDENTIAL_EXPIRED, credentialId, null, expiresAt.get().toString());
        }

        if (!issuerSignatureValid(credential, credentialId)) {
            log.warn("Credential {} has an invalid issuer proof", credentialId);
            return VerificationResult.failure(VerificationResult.INVALID_CREDENTIAL_PROOF, credentialId);
        }

        if (holder != null && !boundTo(credential, holder)) {
            log.warn("Credential {} is not about holder {}", credentialId, holder);
            return VerificationResult.failure(VerificationResult.SUBJECT_MISMATCH, credentialId);
        }
        return null;
    }

    private boolean issuerSignatureValid(CredentialEnvelope credential, String credentialId) {
        Optional<String> token = credential.signedToken();
        if (token.isEmpty()) {
            return false;
        }
        Optional<String> declaredId = credential.declaredId();
        if (declaredId.isPresent() && !declaredId.get().equals(credentialId)) {
            return false;
        }
        try {
            SignedJWT jwt = SignedJWT.parse(token.get());
            if (!JWSAlgorithm.ES256K.equals(jwt.getHeader().getAlgorithm())) {
                return false;
            }
            JWK jwk = jwt.getHeader().getJWK();
            if (!(jwk instanceof ECKey) || !Curve.SECP256K1.equals(((ECKey) jwk).getCurve())) {
                return false;
            }
            ECKey issuerJwk = (ECKey) jwk;
            BigInteger x = issuerJwk.getX().decodeToBigInteger();
            BigInteger y = issuerJwk.getY().decodeToBigInteger();

            ECPublicKey publicKey = Secp256k1Keys.publicKey(x, y);
            ECDSAVerifier verifier = new ECDSAVerifier(publicKey);
            verifier.getJCAContext().setProvider(Secp256k1Keys.ensureProvider());
            if (!jwt.verify(verifier)) {
                return false;
            }

            String issuer = jwt.getJWTClaimsSet().getIssuer();
            DidPkh issuerDid = DidPkh.parse(issuer);
            if (!EthereumSignatures.sameAddress(EthereumSignatures.addressOf(x, y), issuerDid.getAddress())) {
                return false;
            }
            if (!trustedIssuers.contains(issuer)) {
                log.warn("Credential {} was issued by untrusted {}", credentialId, issuer);
                return false;
            }
            return true;
        } catch (ParseException | JOSEException | GeneralSecurityException | MalformedIdentityException e) {
            log.warn("Issuer proof of {} could not be checked: {}", credentialId, e.getMessage());
            return false;
        }
    }

    private boolean boundTo(CredentialEnvelope credential, DidPkh holder) {
        Optional<String> subject = credential.subjectId();
        return subject.isPresent() && sameIdentity(subject.get(), holder);
    }

    // did:pkh addresses compare case-insensitively
    private boolean sameIdentity(String did, DidPkh holder) {
        if (!DidPkh.isValid(did)) {
            return false;
        }
        DidPkh other = DidPkh.parse(did);
        return other.getChainId() == holder.getChainId()
                && EthereumSignatures.sameAddress(other.getAddress(), holder.getAddress());
    }

}
