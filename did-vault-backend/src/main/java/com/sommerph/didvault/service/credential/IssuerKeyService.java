package com.sommerph.didvault.service.credential;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.crypto.ECDSASigner;
import com.nimbusds.jose.jwk.Curve;
import com.nimbusds.jose.jwk.ECKey;
import com.sommerph.didvault.config.VaultProperties;
import com.sommerph.didvault.exception.FatalConfigurationException;
import com.sommerph.didvault.model.auth.DidPkh;
import com.sommerph.didvault.util.EthereumSignatures;
import com.sommerph.didvault.util.Secp256k1Keys;
import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.interfaces.ECPublicKey;

/**
 * Holds the issuer's secp256k1 signing key. The key is loaded once at startup; a
 * missing or invalid key stops the application from starting.
 */
@Slf4j
@Service
public class IssuerKeyService {

    private final VaultProperties config;

    @Getter
    private String issuerDid;

    @Getter
    private String issuerAddress;

    @Getter
    private ECKey publicJwk;

    private KeyPair issuerKeyPair;

    public IssuerKeyService(VaultProperties config) {
        this.config = config;
    }

    @PostConstruct
    public void init() {
        log.info("Load issuer signing key");
        String privateKeyHex = config.getIssuer().getPrivateKey();
        if (privateKeyHex == null || privateKeyHex.isBlank()) {
            throw new FatalConfigurationException("Issuer signing key is not configured (vault.issuer.private-key)");
        }
        org.bitcoinj.core.ECKey key;
        try {
            key = Secp256k1Keys.fromPrivateHex(privateKeyHex);
        } catch (IllegalArgumentException e) {
            throw new FatalConfigurationException("Issuer signing key is invalid: " + e.getMessage(), e);
        }
        try {
            this.issuerKeyPair = Secp256k1Keys.toKeyPair(key);
        } catch (GeneralSecurityException e) {
            throw new FatalConfigurationException("Issuer signing key could not be loaded", e);
        }
        this.issuerAddress = EthereumSignatures.addressOf(key);
        this.issuerDid = DidPkh.of(config.getIssuer().getChainId(), issuerAddress).toString();
        this.publicJwk = new ECKey.Builder(Curve.SECP256K1, (ECPublicKey) issuerKeyPair.getPublic())
                .keyID(verificationMethod())
                .build();
        log.info("Issuer DID is {}", issuerDid);
    }

    public String verificationMethod() {
        return issuerDid + "#controller";
    }

    public ECDSASigner signer() throws JOSEException {
        ECDSASigner signer = new ECDSASigner(issuerKeyPair.getPrivate(), Curve.SECP256K1);
        signer.getJCAContext().setProvider(Secp256k1Keys.ensureProvider());
        return signer;
    }

}
