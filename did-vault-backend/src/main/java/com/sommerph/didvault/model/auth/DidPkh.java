package com.sommerph.didvault.model.auth;

import com.sommerph.didvault.exception.MalformedIdentityException;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code did:pkh:eip155:<chainId>:<0xaddress>} identity.
 */
@Getter
@AllArgsConstructor
public class DidPkh {

    private static final Pattern DID_PKH = Pattern.compile("^did:pkh:eip155:(\\d+):(0x[a-fA-F0-9]{40})$");

    private final long chainId;
    private final String address;

    public static DidPkh parse(String did) {
        if (did == null) {
            throw new MalformedIdentityException("null");
        }
        Matcher m = DID_PKH.matcher(did);
        if (!m.matches()) {
            throw new MalformedIdentityException(did);
        }
        try {
            return new DidPkh(Long.parseLong(m.group(1)), m.group(2));
        } catch (NumberFormatException e) {
            throw new MalformedIdentityException(did);
        }
    }

    public static boolean isValid(String did) {
        try {
            parse(did);
            return true;
        } catch (MalformedIdentityException e) {
            return false;
        }
    }

    public static DidPkh of(long chainId, String address) {
        return new DidPkh(chainId, address.toLowerCase(Locale.ROOT));
    }

    @Override
    public String toString() {
        return "did:pkh:eip155:" + chainId + ":" + address;
    }

}
