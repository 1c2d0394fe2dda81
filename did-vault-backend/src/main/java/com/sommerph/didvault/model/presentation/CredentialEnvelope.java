package com.sommerph.didvault.model.presentation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import com.sommerph.didvault.model.credential.VerifiableCredential;

import java.text.ParseException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.Map;
import java.util.Optional;

/**
 * A credential as carried inside a presentation: either a compact JWT-VC string or
 * a credential object with an inline {@code proof.jwt}. All id, expiry and subject
 * lookups go through the signed token first and fall back to the declared object
 * fields, whichever encoding was used.
 */
public abstract class CredentialEnvelope {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public enum Kind {
        JWT,
        EMBEDDED
    }

    private CredentialEnvelope() {}

    public abstract Kind getKind();

    /** Compact JWT carrying the issuer signature, if the credential has one. */
    public abstract Optional<String> signedToken();

    abstract JsonNode node();

    abstract Optional<String> declared(String field);

    abstract Optional<String> declaredSubject();

    @JsonValue
    public JsonNode toJson() {
        return node().deepCopy();
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static CredentialEnvelope fromJson(JsonNode node) {
        if (node != null && node.isTextual()) {
            return new Jwt(node.asText());
        }
        if (node != null && node.isObject()) {
            return new Embedded((ObjectNode) node.deepCopy());
        }
        throw new IllegalArgumentException("Credential must be a JWT string or a credential object");
    }

    public static CredentialEnvelope ofJwt(String jwt) {
        return new Jwt(jwt);
    }

    public static CredentialEnvelope ofCredential(VerifiableCredential credential) {
        return new Embedded(MAPPER.valueToTree(credential));
    }

    /** Claims of the signed token, read without checking the signature. */
    public final Optional<JWTClaimsSet> signedClaims() {
        Optional<String> token = signedToken();
        if (token.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(SignedJWT.parse(token.get()).getJWTClaimsSet());
        } catch (ParseException e) {
            return Optional.empty();
        }
    }

    /** Revocation key: {@code jti}, then {@code vc.id}, then the declared object id. */
    public final Optional<String> credentialId() {
        Optional<JWTClaimsSet> claims = signedClaims();
        if (claims.isPresent()) {
            String jti = claims.get().getJWTID();
            if (jti != null && !jti.isBlank()) {
                return Optional.of(jti);
            }
            Optional<String> vcId = vcString(claims.get(), "id");
            if (vcId.isPresent()) {
                return vcId;
            }
        }
        return declared("id");
    }

    /**
     * Earliest of the signed {@code exp}, the signed {@code vc.expirationDate} and the
     * declared {@code expirationDate}.
     *
     * @throws IllegalArgumentException if a declared date cannot be parsed
     */
    public final Optional<Instant> expiresAt() {
        Instant earliest = null;
        Optional<JWTClaimsSet> claims = signedClaims();
        if (claims.isPresent()) {
            Date exp = claims.get().getExpirationTime();
            earliest = earlier(earliest, exp == null ? null : exp.toInstant());
            earliest = earlier(earliest, vcString(claims.get(), "expirationDate").map(CredentialEnvelope::parseDate).orElse(null));
        }
        earliest = earlier(earliest, declared("expirationDate").map(CredentialEnvelope::parseDate).orElse(null));
        return Optional.ofNullable(earliest);
    }

    /** {@code credentialSubject.id} of the signed payload, else {@code sub}, else the declared subject. */
    public final Optional<String> subjectId() {
        Optional<JWTClaimsSet> claims = signedClaims();
        if (claims.isPresent()) {
            Object vc = claims.get().getClaim("vc");
            if (vc instanceof Map) {
                Object subject = ((Map<?, ?>) vc).get("credentialSubject");
                if (subject instanceof Map) {
                    Object id = ((Map<?, ?>) subject).get("id");
                    if (id instanceof String) {
                        return Optional.of((String) id);
                    }
                }
            }
            if (claims.get().getSubject() != null) {
                return Optional.of(claims.get().getSubject());
            }
        }
        return declaredSubject();
    }

    /** Id written on the credential object next to its proof, if any. */
    public final Optional<String> declaredId() {
        return declared("id");
    }

    private static Optional<String> vcString(JWTClaimsSet claims, String field) {
        Object vc = claims.getClaim("vc");
        if (vc instanceof Map) {
            Object value = ((Map<?, ?>) vc).get(field);
            if (value instanceof String && !((String) value).isBlank()) {
                return Optional.of((String) value);
            }
        }
        return Optional.empty();
    }

    private static Instant parseDate(String value) {
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Unparseable credential date: " + value, e);
        }
    }

    private static Instant earlier(Instant current, Instant candidate) {
        if (candidate == null) return current;
        if (current == null) return candidate;
        return candidate.isBefore(current) ? candidate : current;
    }

    static final class Jwt extends CredentialEnvelope {

        private final String token;

        private Jwt(String token) {
            this.token = token;
        }

        @Override
        public Kind getKind() {
            return Kind.JWT;
        }

        @Override
        public Optional<String> signedToken() {
            return Optional.of(token);
        }

        @Override
        JsonNode node() {
            return TextNode.valueOf(token);
        }

        @Override
        Optional<String> declared(String field) {
            return Optional.empty();
        }

        @Override
        Optional<String> declaredSubject() {
            return Optional.empty();
        }
    }

    static final class Embedded extends CredentialEnvelope {

        private final ObjectNode credential;

        private Embedded(ObjectNode credential) {
            this.credential = credential;
        }

        @Override
        public Kind getKind() {
            return Kind.EMBEDDED;
        }

        @Override
        public Optional<String> signedToken() {
            JsonNode jwt = credential.path("proof").path("jwt");
            return jwt.isTextual() ? Optional.of(jwt.asText()) : Optional.empty();
        }

        @Override
        JsonNode node() {
            return credential;
        }

        @Override
        Optional<String> declared(String field) {
            JsonNode value = credential.get(field);
            return value != null && value.isTextual() && !value.asText().isBlank()
                    ? Optional.of(value.asText())
                    : Optional.empty();
        }

        @Override
        Optional<String> declaredSubject() {
            JsonNode id = credential.path("credentialSubject").path("id");
            return id.isTextual() ? Optional.of(id.asText()) : Optional.empty();
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CredentialEnvelope)) return false;
        CredentialEnvelope other = (CredentialEnvelope) o;
        return getKind() == other.getKind() && node().equals(other.node());
    }

    @Override
    public int hashCode() {
        return node().hashCode();
    }

    @Override
    public String toString() {
        return "CredentialEnvelope(" + getKind() + ", id=" + credentialId().orElse("?") + ")";
    }

}
