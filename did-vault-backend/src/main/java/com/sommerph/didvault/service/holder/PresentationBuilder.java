package com.sommerph.didvault.service.holder;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sommerph.didvault.exception.ValidationException;
import com.sommerph.didvault.model.auth.DidPkh;
import com.sommerph.didvault.model.credential.VerifiableCredential;
import com.sommerph.didvault.model.presentation.CredentialEnvelope;
import com.sommerph.didvault.model.presentation.PresentationProof;
import com.sommerph.didvault.model.presentation.VerifiablePresentation;
import com.sommerph.didvault.util.EthereumSignatures;
import com.sommerph.didvault.util.PresentationSigning;
import lombok.extern.slf4j.Slf4j;
import org.bitcoinj.core.ECKey;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Bundles credentials into a presentation signed by the holder's key. Credentials
 * are embedded as given, in the order given.
 */
@Slf4j
public class PresentationBuilder {

    private final Clock clock;
    private final ObjectMapper mapper = new ObjectMapper();

    public PresentationBuilder(Clock clock) {
        this.clock = clock;
    }

    public VerifiablePresentation build(String holderId, ECKey holderKey, List<CredentialEnvelope> credentials) {
        if (credentials == null || credentials.isEmpty()) {
            throw new ValidationException("A presentation needs at least one credential");
        }
        DidPkh holder = DidPkh.parse(holderId);
        String keyAddress = EthereumSignatures.addressOf(holderKey);
        if (!EthereumSignatures.sameAddress(keyAddress, holder.getAddress())) {
            throw new ValidationException("Holder key does not control " + holderId);
        }
        log.info("Build presentation for {} with {} credentials", holderId, credentials.size());

        VerifiablePresentation presentation = new VerifiablePresentation(
                List.of(VerifiableCredential.W3C_CREDENTIALS_CONTEXT),
                List.of(VerifiablePresentation.BASE_TYPE),
                holderId,
                new ArrayList<>(credentials),
                null
        );
        String signingInput = PresentationSigning.signingInput(mapper.valueToTree(presentation));
        presentation.setProof(new PresentationProof(
                PresentationProof.RECOVERY_SIGNATURE_TYPE,
                clock.instant().truncatedTo(ChronoUnit.SECONDS).toString(),
                PresentationProof.AUTHENTICATION_PURPOSE,
                holderId + "#controller",
                EthereumSignatures.signPersonalMessage(holderKey, signingInput)
        ));
        return presentation;
    }

    public VerifiablePresentation buildFromCredentials(String holderId, ECKey holderKey, List<VerifiableCredential> credentials) {
        List<CredentialEnvelope> envelopes = new ArrayList<>();
        if (credentials != null) {
            credentials.forEach(c -> envelopes.add(CredentialEnvelope.ofCredential(c)));
        }
        return build(holderId, holderKey, envelopes);
    }

    public VerifiablePresentation buildFromJwts(String holderId, ECKey holderKey, List<String> jwts) {
        List<CredentialEnvelope> envelopes = new ArrayList<>();
        if (jwts != null) {
            jwts.forEach(j -> envelopes.add(CredentialEnvelope.ofJwt(j)));
        }
        return build(holderId, holderKey, envelopes);
    }

}
