package com.ias.distributor.crypto;

import com.ias.distributor.exception.DistributionException;
import com.ias.distributor.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * Verifies 65-byte {@code r ‖ s ‖ v} secp256k1 signatures over the personal-message form of
 * the claim hash, the way the off-chain signer produces them.
 */
@Component
@Slf4j
public class EthereumSignatureVerifier implements AuthorizationVerifier {

    private static final int SIGNATURE_LENGTH = 65;
    private static final BigInteger MAX_UINT256 = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    @Override
    public String verify(AuthorizationToken token, String ledgerAddress, String authorityAddress) {
        if (token.getAmount() == null || token.getAmount().signum() < 0
                || token.getAmount().compareTo(MAX_UINT256) > 0 || token.getEpoch() < 0) {
            throw invalid("claim fields out of range");
        }
        if (!Addresses.isValid(token.getAffiliate()) || !Addresses.isValid(ledgerAddress)
                || !Addresses.isValid(authorityAddress)) {
            throw invalid("malformed address");
        }

        byte[] signature = decodeSignature(token.getSignature());
        BigInteger r = new BigInteger(1, Arrays.copyOfRange(signature, 0, 32));
        BigInteger s = new BigInteger(1, Arrays.copyOfRange(signature, 32, 64));
        int v = signature[64] & 0xff;
        if (v < 27) {
            v += 27;
        }
        if (v != 27 && v != 28) {
            throw invalid("bad recovery id " + v);
        }
        BigInteger n = Secp256k1.DOMAIN.getN();
        if (r.signum() == 0 || r.compareTo(n) >= 0 || s.signum() == 0 || s.compareTo(Secp256k1.HALF_ORDER) > 0) {
            throw invalid("signature values out of range");
        }

        byte[] digest = ClaimMessages.signingDigest(
                token.getAffiliate(), token.getAmount(), token.getEpoch(), ledgerAddress);
        ECPoint publicKey = Secp256k1.recoverPublicKey(v - 27, r, s, digest);
        if (publicKey == null) {
            throw invalid("public key recovery failed");
        }

        String recovered = Secp256k1.addressOf(publicKey);
        if (!recovered.equalsIgnoreCase(authorityAddress)) {
            log.debug("Signature for {} epoch {} recovered to {}, expected {}",
                    token.getAffiliate(), token.getEpoch(), recovered, authorityAddress);
            throw invalid("signer is not the authority");
        }
        return recovered;
    }

    private static byte[] decodeSignature(String signature) {
        if (signature == null) {
            throw invalid("missing signature");
        }
        String hex = signature.startsWith("0x") || signature.startsWith("0X") ? signature.substring(2) : signature;
        if (hex.length() != SIGNATURE_LENGTH * 2) {
            throw invalid("signature must be " + SIGNATURE_LENGTH + " bytes");
        }
        try {
            return Hex.decode(hex);
        } catch (DecoderException e) {
            throw new DistributionException(ErrorCode.INVALID_SIGNATURE, "Invalid signature: not hex", e);
        }
    }

    private static DistributionException invalid(String reason) {
        return new DistributionException(ErrorCode.INVALID_SIGNATURE, "Invalid signature: " + reason);
    }
}
