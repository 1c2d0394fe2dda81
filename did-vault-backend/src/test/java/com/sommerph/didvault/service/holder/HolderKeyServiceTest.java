package com.sommerph.didvault.service.holder;

import com.sommerph.didvault.support.TestFixtures;
import org.bitcoinj.core.ECKey;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HolderKeyServiceTest {

    private static final String DEV_MNEMONIC = "test test test test test test test test test test test junk";

    private final HolderKeyService keyService = new HolderKeyService(1);

    @Test
    void derivesStandardEthereumAccountsFromMnemonic() {
        ECKey first = keyService.deriveAccountKey(DEV_MNEMONIC, 0);
        ECKey second = keyService.deriveAccountKey(DEV_MNEMONIC, 1);

        assertThat(keyService.addressOf(first)).isEqualTo(TestFixtures.HOLDER_ADDRESS);
        assertThat(keyService.didOf(first)).isEqualTo(TestFixtures.HOLDER_DID);
        assertThat(keyService.didOf(second)).isEqualTo(TestFixtures.ISSUER_DID);
    }

    @Test
    void generatedMnemonicHasTwelveWordsAndDerives() {
        String mnemonic = keyService.generateMnemonic();

        assertThat(mnemonic.split(" ")).hasSize(12);
        assertThat(keyService.didOf(keyService.deriveAccountKey(mnemonic, 0))).startsWith("did:pkh:eip155:1:0x");
    }

    @Test
    void rejectsInvalidMnemonicAndNegativeIndex() {
        assertThatThrownBy(() -> keyService.deriveAccountKey("test test test", 0)).isInstanceOf(RuntimeException.class);
        assertThatThrownBy(() -> keyService.deriveAccountKey(DEV_MNEMONIC, -1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void importedKeyMatchesDerivedKey() {
        ECKey imported = keyService.importPrivateKey(TestFixtures.HOLDER_KEY);

        assertThat(keyService.didOf(imported)).isEqualTo(TestFixtures.HOLDER_DID);
    }

}
