package com.sommerph.didvault.service.credential;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JOSEObjectType;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import com.sommerph.didvault.config.VaultProperties;
import com.sommerph.didvault.exception.AuthorizationException;
import com.sommerph.didvault.exception.ValidationException;
import com.sommerph.didvault.model.auth.DidPkh;
import com.sommerph.didvault.model.credential.CredentialProof;
import com.sommerph.didvault.model.credential.IssuanceAuditRecord;
import com.sommerph.didvault.model.credential.IssuedCredential;
import com.sommerph.didvault.model.credential.VerifiableCredential;
import com.sommerph.didvault.repository.audit.IssuanceAuditLog;
import com.sommerph.didvault.service.auth.SessionTokenService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Issues ES256K-signed JWT credentials to subjects holding a session for the same DID.
 */
@Slf4j
@Service
public class CredentialIssuer {

    public static final String ID_PREFIX = "urn:uuid:";
    public static final String RESERVED_SUBJECT_KEY = "id";

    private final SessionTokenService sessionTokenService;
    private final IssuerKeyService keyService;
    private final IssuanceAuditLog auditLog;
    private final VaultProperties.Issuer config;
    private final Clock clock;
    private final ObjectMapper mapper = new ObjectMapper();

    public CredentialIssuer(SessionTokenService sessionTokenService,
                            IssuerKeyService keyService,
                            IssuanceAuditLog auditLog,
                            VaultProperties properties,
                            Clock clock) {
        this.sessionTokenService = sessionTokenService;
        this.keyService = keyService;
        this.auditLog = auditLog;
        this.config = properties.getIssuer();
        this.clock = clock;
    }

    public IssuedCredential issue(String sessionToken, String subjectId, Map<String, Object> claims) {
        return issue(sessionToken, subjectId, claims, null);
    }

    public IssuedCredential issue(String sessionToken, String subjectId, Map<String, Object> claims, Integer validityDays) {
        String sessionSubject = sessionTokenService.validate(sessionToken);
        DidPkh.parse(subjectId);
        if (!sessionSubject.equals(subjectId)) {
            log.warn("Session for {} tried to obtain a credential for {}", sessionSubject, subjectId);
            throw new AuthorizationException("Session is not authorized to request credentials for " + subjectId);
        }
        int days = validityDays == null ? config.getDefaultValidityDays() : validityDays;
        if (days < 1 || days > config.getMaxValidityDays()) {
            throw new ValidationException("validityDays must be between 1 and " + config.getMaxValidityDays());
        }
        if (claims == null) {
            throw new ValidationException("credentialSubject must be an object");
        }
        if (claims.containsKey(RESERVED_SUBJECT_KEY)) {
            throw new ValidationException("credentialSubject must not set the reserved key '" + RESERVED_SUBJECT_KEY + "'");
        }

        log.info("Issue credential for subject {} valid for {} days", subjectId, days);
        String credentialId = ID_PREFIX + UUID.randomUUID();
        Instant issuedAt = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant expiresAt = issuedAt.plus(Duration.ofDays(days));
        List<String> types = List.of(VerifiableCredential.BASE_TYPE, config.getCredentialType());

        Map<String, Object> credentialSubject = new LinkedHashMap<>();
        credentialSubject.put(RESERVED_SUBJECT_KEY, subjectId);
        credentialSubject.putAll(claims);

        VerifiableCredential credential = new VerifiableCredential(
                List.of(VerifiableCredential.W3C_CREDENTIALS_CONTEXT),
                credentialId,
                types,
                keyService.getIssuerDid(),
                issuedAt.toString(),
                expiresAt.toString(),
                credentialSubject,
                null
        );

        String jwt = sign(credential, subjectId, issuedAt, expiresAt);
        credential.setProof(new CredentialProof(CredentialProof.JWT_PROOF_TYPE, jwt));

        auditLog.append(new IssuanceAuditRecord(
                issuedAt.toString(),
                keyService.getIssuerDid(),
                subjectId,
                credentialId,
                types,
                IssuanceAuditRecord.ACTION_ISSUED
        ));
        return new IssuedCredential(credential, jwt, credentialId, expiresAt.toString());
    }

    private String sign(VerifiableCredential credential, String subjectId, Instant issuedAt, Instant expiresAt) {
        try {
            Map<String, Object> vc = mapper.convertValue(credential, new TypeReference<Map<String, Object>>() {});
            JWTClaimsSet claims = new JWTClaimsSet.Builder()
                    .issuer(keyService.getIssuerDid())
                    .subject(subjectId)
                    .issueTime(Date.from(issuedAt))
                    .notBeforeTime(Date.from(issuedAt))
                    .expirationTime(Date.from(expiresAt))
                    .jwtID(credential.getId())
                    .claim("vc", vc)
                    .build();
            JWSHeader header = new JWSHeader.Builder(JWSAlgorithm.ES256K)
                    .type(JOSEObjectType.JWT)
                    .keyID(keyService.verificationMethod())
                    .jwk(keyService.getPublicJwk())
                    .build();
            SignedJWT jwt = new SignedJWT(header, claims);
            jwt.sign(keyService.signer());
            return jwt.serialize();
        } catch (JOSEException e) {
            log.error("Failed to sign credential {} for subject {}", credential.getId(), subjectId, e);
            throw new IllegalStateException("Credential signing failed for " + credential.getId(), e);
        }
    }

}
