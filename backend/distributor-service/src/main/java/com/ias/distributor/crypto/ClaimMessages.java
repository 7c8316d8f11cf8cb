package com.ias.distributor.crypto;

import org.bouncycastle.util.BigIntegers;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Canonical claim message layout shared with the off-chain signer:
 * {@code keccak256(affiliate ‖ uint256 amount ‖ uint256 epoch ‖ ledger)} wrapped as an
 * Ethereum personal message.
 */
public final class ClaimMessages {

    private static final byte[] PERSONAL_MESSAGE_PREFIX =
            "\u0019Ethereum Signed Message:\n32".getBytes(StandardCharsets.US_ASCII);

    private static final int UINT256_BYTES = 32;

    private ClaimMessages() {
    }

    /**
     * Tightly packed encoding of the four bound fields (104 bytes)
     */
    public static byte[] packed(String affiliate, BigInteger amount, long epoch, String ledgerAddress) {
        return ByteBuffer.allocate(20 + UINT256_BYTES + UINT256_BYTES + 20)
                .put(Addresses.toBytes(affiliate))
                .put(BigIntegers.asUnsignedByteArray(UINT256_BYTES, amount))
                .put(BigIntegers.asUnsignedByteArray(UINT256_BYTES, BigInteger.valueOf(epoch)))
                .put(Addresses.toBytes(ledgerAddress))
                .array();
    }

    public static byte[] messageHash(String affiliate, BigInteger amount, long epoch, String ledgerAddress) {
        return Keccak.hash256(packed(affiliate, amount, epoch, ledgerAddress));
    }

    public static byte[] personalMessageHash(byte[] messageHash) {
        return Keccak.hash256(ByteBuffer.allocate(PERSONAL_MESSAGE_PREFIX.length + messageHash.length)
                .put(PERSONAL_MESSAGE_PREFIX)
                .put(messageHash)
                .array());
    }

    /**
     * The digest the authority actually signs
     */
    public static byte[] signingDigest(String affiliate, BigInteger amount, long epoch, String ledgerAddress) {
        return personalMessageHash(messageHash(affiliate, amount, epoch, ledgerAddress));
    }
}
