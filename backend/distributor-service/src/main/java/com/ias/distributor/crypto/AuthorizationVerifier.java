package com.ias.distributor.crypto;

import com.ias.distributor.exception.DistributionException;

/**
 * Checks that an authorization token was signed by the designated authority for this ledger.
 * Implementations must be stateless.
 */
public interface AuthorizationVerifier {

    /**
     * @param token            the claimed payout and its signature
     * @param ledgerAddress    identity of the verifying ledger, bound into the signed message
     * @param authorityAddress identity the signature must recover to
     * @return the authority identity the signature recovered to
     * @throws DistributionException with {@code INVALID_SIGNATURE} on any mismatch or malformed input
     */
    String verify(AuthorizationToken token, String ledgerAddress, String authorityAddress);
}
