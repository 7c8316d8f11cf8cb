package com.ias.distributor.crypto;

import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.params.ECPrivateKeyParameters;
import org.bouncycastle.crypto.signers.ECDSASigner;
import org.bouncycastle.crypto.signers.HMacDSAKCalculator;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.util.BigIntegers;
import org.bouncycastle.util.encoders.Hex;

import java.math.BigInteger;
import java.nio.ByteBuffer;

/**
 * Stand-in for the off-chain signer: produces {@code r ‖ s ‖ v} signatures over claim digests.
 */
public final class TestSigner {

    /** Well-known development key; its address is 0xf39Fd6e51aad88F6F4ce6aB8827279cffFb92266. */
    public static final String DEV_KEY_0 = "ac0974bec39a17e36ba4a6b4d238ff944bacb478cbed5efcae784d7bf4f2ff80";
    public static final String DEV_KEY_1 = "59c6995e998f97a5a0044966f0945389dc9e86dae88c7a8412f4603b6b78690d";

    private final BigInteger privateKey;
    private final ECPoint publicKey;

    public TestSigner(String hexKey) {
        this.privateKey = new BigInteger(1, Hex.decode(hexKey));
        this.publicKey = Secp256k1.DOMAIN.getG().multiply(privateKey).normalize();
    }

    public String address() {
        return Secp256k1.addressOf(publicKey);
    }

    public String signClaim(String affiliate, BigInteger amount, long epoch, String ledgerAddress) {
        return "0x" + Hex.toHexString(sign(ClaimMessages.signingDigest(affiliate, amount, epoch, ledgerAddress)));
    }

    /**
     * Canonical low-s signature with v in {27, 28}
     */
    public byte[] sign(byte[] digest) {
        ECDSASigner signer = new ECDSASigner(new HMacDSAKCalculator(new SHA256Digest()));
        signer.init(true, new ECPrivateKeyParameters(privateKey, Secp256k1.DOMAIN));
        BigInteger[] rs = signer.generateSignature(digest);
        BigInteger r = rs[0];
        BigInteger s = rs[1];
        if (s.compareTo(Secp256k1.HALF_ORDER) > 0) {
            s = Secp256k1.DOMAIN.getN().subtract(s);
        }

        int recId = -1;
        for (int i = 0; i < 2; i++) {
            ECPoint candidate = Secp256k1.recoverPublicKey(i, r, s, digest);
            if (candidate != null && candidate.equals(publicKey)) {
                recId = i;
                break;
            }
        }
        if (recId < 0) {
            throw new IllegalStateException("Could not determine recovery id");
        }

        return ByteBuffer.allocate(65)
                .put(BigIntegers.asUnsignedByteArray(32, r))
                .put(BigIntegers.asUnsignedByteArray(32, s))
                .put((byte) (27 + recId))
                .array();
    }
}
