package com.ias.distributor.crypto;

import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.asn1.x9.X9IntegerConverter;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.math.ec.ECAlgorithms;
import org.bouncycastle.math.ec.ECPoint;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * Public key recovery over secp256k1 (SEC 1 v2, section 4.1.6)
 */
public final class Secp256k1 {

    private static final X9ECParameters PARAMS = CustomNamedCurves.getByName("secp256k1");

    public static final ECDomainParameters DOMAIN =
            new ECDomainParameters(PARAMS.getCurve(), PARAMS.getG(), PARAMS.getN(), PARAMS.getH());

    public static final BigInteger HALF_ORDER = DOMAIN.getN().shiftRight(1);

    private Secp256k1() {
    }

    /**
     * Recover the signer's public key from a signature over a 32-byte hash.
     *
     * @return the recovered point, or {@code null} if no key can be recovered for this recovery id
     */
    public static ECPoint recoverPublicKey(int recId, BigInteger r, BigInteger s, byte[] hash) {
        BigInteger n = DOMAIN.getN();
        BigInteger x = r.add(BigInteger.valueOf(recId / 2).multiply(n));
        BigInteger prime = DOMAIN.getCurve().getField().getCharacteristic();
        if (x.compareTo(prime) >= 0) {
            return null;
        }

        ECPoint point;
        try {
            point = decompressKey(x, (recId & 1) == 1);
        } catch (IllegalArgumentException e) {
            // x is not on the curve
            return null;
        }
        if (!point.multiply(n).isInfinity()) {
            return null;
        }

        BigInteger e = new BigInteger(1, hash);
        BigInteger eInv = BigInteger.ZERO.subtract(e).mod(n);
        BigInteger rInv = r.modInverse(n);
        BigInteger srInv = rInv.multiply(s).mod(n);
        BigInteger eInvrInv = rInv.multiply(eInv).mod(n);
        ECPoint q = ECAlgorithms.sumOfTwoMultiplies(DOMAIN.getG(), eInvrInv, point, srInv);
        return q.isInfinity() ? null : q.normalize();
    }

    /**
     * Address of a public key: the last 20 bytes of the Keccak-256 hash of its uncompressed encoding
     */
    public static String addressOf(ECPoint publicKey) {
        byte[] encoded = publicKey.normalize().getEncoded(false);
        byte[] hash = Keccak.hash256(Arrays.copyOfRange(encoded, 1, encoded.length));
        return Addresses.fromBytes(Arrays.copyOfRange(hash, hash.length - 20, hash.length));
    }

    private static ECPoint decompressKey(BigInteger x, boolean yOdd) {
        X9IntegerConverter converter = new X9IntegerConverter();
        byte[] encoded = converter.integerToBytes(x, 1 + converter.getByteLength(DOMAIN.getCurve()));
        encoded[0] = (byte) (yOdd ? 0x03 : 0x02);
        return DOMAIN.getCurve().decodePoint(encoded);
    }
}
