package com.sommerph.didvault.model.auth;

import com.sommerph.didvault.exception.MalformedIdentityException;
import com.sommerph.didvault.exception.ValidationException;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DidPkhTest {

    @Test
    void parsesChainAndAddress() {
        DidPkh did = DidPkh.parse("did:pkh:eip155:137:0xF39Fd6e51aad88F6F4ce6aB8827279cffFb92266");

        assertThat(did.getChainId()).isEqualTo(137);
        assertThat(did.getAddress()).isEqualTo("0xF39Fd6e51aad88F6F4ce6aB8827279cffFb92266");
        assertThat(did.toString()).isEqualTo("did:pkh:eip155:137:0xF39Fd6e51aad88F6F4ce6aB8827279cffFb92266");
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "did:pkh:eip155:1:0x123",
            "did:ethr:0xf39fd6e51aad88f6f4ce6ab8827279cfffb92266",
            "did:pkh:eip155:x:0xf39fd6e51aad88f6f4ce6ab8827279cfffb92266",
            "did:pkh:eip155:1:f39fd6e51aad88f6f4ce6ab8827279cfffb92266",
            "did:pkh:eip155:1:0xf39fd6e51aad88f6f4ce6ab8827279cfffb92266 ",
            "did:pkh:eip155:99999999999999999999:0xf39fd6e51aad88f6f4ce6ab8827279cfffb92266"
    })
    void rejectsMalformedIdentities(String did) {
        assertThat(DidPkh.isValid(did)).isFalse();
        assertThatThrownBy(() -> DidPkh.parse(did))
                .isInstanceOf(MalformedIdentityException.class)
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void rejectsNull() {
        assertThat(DidPkh.isValid(null)).isFalse();
        assertThatThrownBy(() -> DidPkh.parse(null)).isInstanceOf(MalformedIdentityException.class);
    }

    @Test
    void ofLowercasesAddress() {
        assertThat(DidPkh.of(1, "0xF39Fd6e51aad88F6F4ce6aB8827279cffFb92266").toString())
                .isEqualTo("did:pkh:eip155:1:0xf39fd6e51aad88f6f4ce6ab8827279cfffb92266");
    }

}
