package com.ias.distributor.crypto;

import lombok.Value;

import java.math.BigInteger;

/**
 * Off-chain approval for a single pull-path payout
 */
@Value
public class AuthorizationToken {
    String affiliate;
    BigInteger amount;
    long epoch;
    String signature;
}
