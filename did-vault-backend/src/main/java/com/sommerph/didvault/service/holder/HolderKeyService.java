package com.sommerph.didvault.service.holder;

import com.sommerph.didvault.model.auth.DidPkh;
import com.sommerph.didvault.util.EthereumSignatures;
import com.sommerph.didvault.util.Secp256k1Keys;
import lombok.extern.slf4j.Slf4j;
import org.bitcoinj.core.ECKey;
import org.bitcoinj.crypto.ChildNumber;
import org.bitcoinj.crypto.DeterministicKey;
import org.bitcoinj.crypto.HDUtils;
import org.bitcoinj.crypto.MnemonicCode;
import org.bitcoinj.wallet.DeterministicKeyChain;
import org.bitcoinj.wallet.DeterministicSeed;

import java.security.SecureRandom;
import java.util.List;

/**
 * Holder-side key material: BIP-39 mnemonics and BIP-44 Ethereum account keys
 * ({@code m/44'/60'/0'/0/index}).
 */
@Slf4j
public class HolderKeyService {

    private static final String ETHEREUM_ACCOUNT_PATH = "M/44H/60H/0H/0/";

    private final long chainId;

    public HolderKeyService(long chainId) {
        this.chainId = chainId;
    }

    public String generateMnemonic() {
        log.info("Generate holder mnemonic");
        try {
            byte[] entropy = new byte[16]; // 128 bit = 12 words
            SecureRandom.getInstanceStrong().nextBytes(entropy);
            return String.join(" ", MnemonicCode.INSTANCE.toMnemonic(entropy));
        } catch (Exception e) {
            log.error("Failed to generate mnemonic", e);
            throw new RuntimeException("Mnemonic generation failed", e);
        }
    }

    public ECKey deriveAccountKey(String mnemonic, int index) {
        log.info("Derive holder account key at index {}", index);
        if (index < 0) {
            throw new IllegalArgumentException("Account index must not be negative");
        }
        try {
            List<String> words = List.of(mnemonic.trim().split("\\s+"));
            MnemonicCode.INSTANCE.check(words);
            DeterministicSeed seed = new DeterministicSeed(words, null, "", 0L);
            DeterministicKeyChain keyChain = DeterministicKeyChain.builder().seed(seed).build();
            List<ChildNumber> path = HDUtils.parsePath(ETHEREUM_ACCOUNT_PATH + index);
            DeterministicKey key = keyChain.getKeyByPath(path, true);
            return ECKey.fromPrivate(key.getPrivKey(), false);
        } catch (Exception e) {
            log.error("Failed to derive holder account key at index {}", index, e);
            throw new RuntimeException("Holder key derivation failed", e);
        }
    }

    public ECKey importPrivateKey(String privateKeyHex) {
        return Secp256k1Keys.fromPrivateHex(privateKeyHex);
    }

    public String addressOf(ECKey key) {
        return EthereumSignatures.addressOf(key);
    }

    public String didOf(ECKey key) {
        return DidPkh.of(chainId, addressOf(key)).toString();
    }

}
