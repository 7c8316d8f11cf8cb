package com.ias.distributor.crypto;

import com.ias.distributor.exception.DistributionException;
import com.ias.distributor.exception.ErrorCode;
import org.bouncycastle.util.encoders.Hex;

import java.util.regex.Pattern;

/**
 * Helpers for 20-byte account addresses in 0x-prefixed hex form
 */
public final class Addresses {

    private static final Pattern ADDRESS_PATTERN = Pattern.compile("^0x[a-fA-F0-9]{40}$");

    private Addresses() {
    }

    public static boolean isValid(String address) {
        return address != null && ADDRESS_PATTERN.matcher(address).matches();
    }

    /**
     * Lower-cases a well-formed address, failing with {@link ErrorCode#INVALID_ADDRESS} otherwise
     */
    public static String normalize(String address) {
        if (!isValid(address)) {
            throw new DistributionException(ErrorCode.INVALID_ADDRESS, "Invalid address: " + address);
        }
        return address.toLowerCase();
    }

    public static byte[] toBytes(String address) {
        return Hex.decode(normalize(address).substring(2));
    }

    public static String fromBytes(byte[] address) {
        return "0x" + Hex.toHexString(address);
    }
}
