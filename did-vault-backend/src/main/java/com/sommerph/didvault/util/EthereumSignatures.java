package com.sommerph.didvault.util;

import org.bitcoinj.core.ECKey;
import org.bitcoinj.core.Sha256Hash;
import org.bouncycastle.crypto.digests.KeccakDigest;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.SignatureException;
import java.util.Locale;

/**
 * EIP-191 personal message signing and signer recovery on secp256k1.
 * Signatures are 65 bytes {@code r || s || v} rendered as 0x-prefixed hex.
 */
public class EthereumSignatures {

    private static final String PERSONAL_MESSAGE_PREFIX = "\u0019Ethereum Signed Message:\n";

    private EthereumSignatures() {}

    public static byte[] keccak256(byte[] input) {
        KeccakDigest digest = new KeccakDigest(256);
        digest.update(input, 0, input.length);
        byte[] out = new byte[32];
        digest.doFinal(out, 0);
        return out;
    }

    public static byte[] personalMessageHash(String message) {
        byte[] body = message.getBytes(StandardCharsets.UTF_8);
        byte[] prefix = (PERSONAL_MESSAGE_PREFIX + body.length).getBytes(StandardCharsets.UTF_8);
        byte[] input = new byte[prefix.length + body.length];
        System.arraycopy(prefix, 0, input, 0, prefix.length);
        System.arraycopy(body, 0, input, prefix.length, body.length);
        return keccak256(input);
    }

    public static String signPersonalMessage(ECKey key, String message) {
        Sha256Hash hash = Sha256Hash.wrap(personalMessageHash(message));
        ECKey.ECDSASignature sig = key.sign(hash);
        int recId = -1;
        for (int i = 0; i < 2; i++) {
            ECKey candidate = ECKey.recoverFromSignature(i, sig, hash, false);
            if (candidate != null && candidate.getPubKeyPoint().equals(key.getPubKeyPoint())) {
                recId = i;
                break;
            }
        }
        if (recId < 0) {
            throw new IllegalStateException("Could not determine recovery id for signature");
        }
        byte[] out = new byte[65];
        System.arraycopy(toBytes32(sig.r), 0, out, 0, 32);
        System.arraycopy(toBytes32(sig.s), 0, out, 32, 32);
        out[64] = (byte) (27 + recId);
        return "0x" + Hex.toHexString(out);
    }

    /**
     * Recovers the lowercase 0x address that produced {@code signature} over the
     * EIP-191 hash of {@code message}.
     */
    public static String recoverAddress(String message, String signature) throws SignatureException {
        byte[] raw = decodeSignature(signature);
        int v = raw[64] & 0xFF;
        if (v >= 27) {
            v -= 27;
        }
        if (v != 0 && v != 1) {
            throw new SignatureException("Unsupported recovery id: " + (raw[64] & 0xFF));
        }
        BigInteger r = new BigInteger(1, slice(raw, 0, 32));
        BigInteger s = new BigInteger(1, slice(raw, 32, 64));
        BigInteger n = ECKey.CURVE.getN();
        if (r.signum() == 0 || s.signum() == 0 || r.compareTo(n) >= 0 || s.compareTo(n) >= 0) {
            throw new SignatureException("Signature component out of range");
        }
        ECKey recovered;
        try {
            recovered = ECKey.recoverFromSignature(v, new ECKey.ECDSASignature(r, s),
                    Sha256Hash.wrap(personalMessageHash(message)), false);
        } catch (RuntimeException e) {
            throw new SignatureException("Public key recovery failed", e);
        }
        if (recovered == null) {
            throw new SignatureException("Public key recovery failed");
        }
        return addressOf(recovered);
    }

    public static String addressOf(ECKey key) {
        byte[] uncompressed = key.getPubKeyPoint().getEncoded(false);
        return addressOfUncompressed(uncompressed);
    }

    public static String addressOf(BigInteger x, BigInteger y) {
        byte[] uncompressed = new byte[65];
        uncompressed[0] = 0x04;
        System.arraycopy(toBytes32(x), 0, uncompressed, 1, 32);
        System.arraycopy(toBytes32(y), 0, uncompressed, 33, 32);
        return addressOfUncompressed(uncompressed);
    }

    public static boolean sameAddress(String a, String b) {
        return a != null && b != null && a.toLowerCase(Locale.ROOT).equals(b.toLowerCase(Locale.ROOT));
    }

    private static String addressOfUncompressed(byte[] uncompressed) {
        byte[] hash = keccak256(slice(uncompressed, 1, 65));
        return "0x" + Hex.toHexString(slice(hash, 12, 32));
    }

    private static byte[] decodeSignature(String signature) throws SignatureException {
        if (signature == null) {
            throw new SignatureException("Missing signature");
        }
        String hex = signature.startsWith("0x") || signature.startsWith("0X") ? signature.substring(2) : signature;
        if (hex.length() != 130) {
            throw new SignatureException("Signature must be 65 bytes");
        }
        try {
            return Hex.decode(hex);
        } catch (DecoderException e) {
            throw new SignatureException("Signature is not hex encoded", e);
        }
    }

    private static byte[] slice(byte[] data, int from, int to) {
        byte[] out = new byte[to - from];
        System.arraycopy(data, from, out, 0, out.length);
        return out;
    }

    static byte[] toBytes32(BigInteger value) {
        byte[] bytes = value.toByteArray();
        if (bytes.length == 32) return bytes;
        byte[] padded = new byte[32];
        int srcPos = Math.max(0, bytes.length - 32);
        int length = bytes.length - srcPos;
        System.arraycopy(bytes, srcPos, padded, 32 - length, length);
        return padded;
    }

}
