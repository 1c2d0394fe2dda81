package com.sommerph.didvault.service.auth;

import com.sommerph.didvault.exception.AuthenticationException;
import com.sommerph.didvault.exception.AuthenticationException.Reason;
import com.sommerph.didvault.model.auth.DidPkh;
import com.sommerph.didvault.model.auth.SessionToken;
import com.sommerph.didvault.util.EthereumSignatures;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.security.SignatureException;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuthenticationVerifier {

    private final ChallengeRegistry challengeRegistry;
    private final SessionTokenService sessionTokenService;

    /**
     * Exchanges a signed challenge for a session token. The challenge is spent even if
     * the signature check that follows fails.
     */
    public SessionToken verify(String subjectId, String nonce, String signature) {
        log.info("Verify challenge response for subject {}", subjectId);
        challengeRegistry.consume(subjectId, nonce);
        DidPkh did = DidPkh.parse(subjectId);

        String recovered;
        try {
            recovered = EthereumSignatures.recoverAddress(nonce, signature);
        } catch (SignatureException e) {
            throw new AuthenticationException(Reason.INVALID_SIGNATURE, "Signature recovery failed for " + subjectId, e);
        }
        if (!EthereumSignatures.sameAddress(recovered, did.getAddress())) {
            throw new AuthenticationException(Reason.ADDRESS_MISMATCH,
                    "Recovered signer " + recovered + " does not control " + subjectId);
        }
        log.info("Subject {} proved key possession", subjectId);
        return sessionTokenService.mint(subjectId);
    }

}
