package com.sommerph.didvault.service.holder;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sommerph.didvault.exception.MalformedIdentityException;
import com.sommerph.didvault.exception.ValidationException;
import com.sommerph.didvault.model.presentation.CredentialEnvelope;
import com.sommerph.didvault.model.presentation.PresentationProof;
import com.sommerph.didvault.model.presentation.VerifiablePresentation;
import com.sommerph.didvault.support.MutableClock;
import com.sommerph.didvault.support.TestFixtures;
import com.sommerph.didvault.util.EthereumSignatures;
import com.sommerph.didvault.util.PresentationSigning;
import com.sommerph.didvault.util.Secp256k1Keys;
import org.bitcoinj.core.ECKey;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PresentationBuilderTest {

    private final PresentationBuilder builder = new PresentationBuilder(new MutableClock(TestFixtures.START));
    private final ECKey holderKey = Secp256k1Keys.fromPrivateHex(TestFixtures.HOLDER_KEY);

    @Test
    void signsPresentationWithHolderKey() throws Exception {
        VerifiablePresentation presentation = builder.buildFromJwts(TestFixtures.HOLDER_DID, holderKey, List.of("a.b.c", "d.e.f"));

        assertThat(presentation.getType()).containsExactly("VerifiablePresentation");
        assertThat(presentation.getHolder()).isEqualTo(TestFixtures.HOLDER_DID);
        assertThat(presentation.getVerifiableCredential()).containsExactly(CredentialEnvelope.ofJwt("a.b.c"), CredentialEnvelope.ofJwt("d.e.f"));

        PresentationProof proof = presentation.getProof();
        assertThat(proof.getType()).isEqualTo(PresentationProof.RECOVERY_SIGNATURE_TYPE);
        assertThat(proof.getProofPurpose()).isEqualTo("authentication");
        assertThat(proof.getVerificationMethod()).isEqualTo(TestFixtures.HOLDER_DID + "#controller");
        assertThat(proof.getCreated()).isEqualTo(TestFixtures.START.toString());

        String signingInput = PresentationSigning.signingInput(new ObjectMapper().valueToTree(presentation));
        assertThat(EthereumSignatures.recoverAddress(signingInput, proof.getProofValue())).isEqualTo(TestFixtures.HOLDER_ADDRESS);
    }

    @Test
    void emptyCredentialListIsRejected() {
        assertThatThrownBy(() -> builder.build(TestFixtures.HOLDER_DID, holderKey, List.of()))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> builder.buildFromCredentials(TestFixtures.HOLDER_DID, holderKey, null))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void keyMustControlHolderIdentity() {
        assertThatThrownBy(() -> builder.buildFromJwts(TestFixtures.OTHER_DID, holderKey, List.of("a.b.c")))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("does not control");
        assertThatThrownBy(() -> builder.buildFromJwts("did:web:example.com", holderKey, List.of("a.b.c")))
                .isInstanceOf(MalformedIdentityException.class);
    }

}
