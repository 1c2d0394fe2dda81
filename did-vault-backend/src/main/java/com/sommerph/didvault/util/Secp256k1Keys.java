package com.sommerph.didvault.util;

import org.bitcoinj.core.ECKey;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;

import java.math.BigInteger;
import java.security.AlgorithmParameters;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.Provider;
import java.security.Security;
import java.security.interfaces.ECPublicKey;
import java.security.spec.ECGenParameterSpec;
import java.security.spec.ECParameterSpec;
import java.security.spec.ECPoint;
import java.security.spec.ECPrivateKeySpec;
import java.security.spec.ECPublicKeySpec;

/**
 * Bridges bitcoinj secp256k1 keys to JCA keys backed by BouncyCastle, which JOSE
 * signing needs. The JDK provider does not ship secp256k1.
 */
public class Secp256k1Keys {

    private static final String CURVE = "secp256k1";

    private Secp256k1Keys() {}

    public static Provider ensureProvider() {
        Provider provider = Security.getProvider(BouncyCastleProvider.PROVIDER_NAME);
        if (provider == null) {
            provider = new BouncyCastleProvider();
            Security.addProvider(provider);
        }
        return provider;
    }

    public static ECKey fromPrivateHex(String privateKeyHex) {
        if (privateKeyHex == null || privateKeyHex.isBlank()) {
            throw new IllegalArgumentException("Private key is empty");
        }
        String hex = privateKeyHex.trim();
        if (hex.startsWith("0x") || hex.startsWith("0X")) {
            hex = hex.substring(2);
        }
        if (hex.length() != 64) {
            throw new IllegalArgumentException("Private key must be 32 bytes of hex");
        }
        BigInteger d;
        try {
            d = new BigInteger(1, Hex.decode(hex));
        } catch (DecoderException e) {
            throw new IllegalArgumentException("Private key is not hex encoded", e);
        }
        if (d.signum() == 0 || d.compareTo(ECKey.CURVE.getN()) >= 0) {
            throw new IllegalArgumentException("Private key is outside the secp256k1 range");
        }
        return ECKey.fromPrivate(d, false);
    }

    public static KeyPair toKeyPair(ECKey key) throws GeneralSecurityException {
        ECParameterSpec ecSpec = parameterSpec();
        KeyFactory factory = KeyFactory.getInstance("EC", ensureProvider());

        org.bouncycastle.math.ec.ECPoint q = key.getPubKeyPoint().normalize();
        ECPoint w = new ECPoint(q.getAffineXCoord().toBigInteger(), q.getAffineYCoord().toBigInteger());

        ECPublicKey pubKey = (ECPublicKey) factory.generatePublic(new ECPublicKeySpec(w, ecSpec));
        PrivateKey privKey = factory.generatePrivate(new ECPrivateKeySpec(key.getPrivKey(), ecSpec));
        return new KeyPair(pubKey, privKey);
    }

    public static ECPublicKey publicKey(BigInteger x, BigInteger y) throws GeneralSecurityException {
        KeyFactory factory = KeyFactory.getInstance("EC", ensureProvider());
        return (ECPublicKey) factory.generatePublic(new ECPublicKeySpec(new ECPoint(x, y), parameterSpec()));
    }

    private static ECParameterSpec parameterSpec() throws GeneralSecurityException {
        AlgorithmParameters parameters = AlgorithmParameters.getInstance("EC", ensureProvider());
        parameters.init(new ECGenParameterSpec(CURVE));
        return parameters.getParameterSpec(ECParameterSpec.class);
    }

}
