package com.ias.distributor.gateway;

import lombok.Value;

import java.math.BigInteger;

/**
 * Outcome of a single asset transfer
 */
@Value
public class TransferReceipt {
    boolean success;
    String recipient;
    BigInteger amount;
    String reference;
    String failureReason;

    public static TransferReceipt ok(String recipient, BigInteger amount, String reference) {
        return new TransferReceipt(true, recipient, amount, reference, null);
    }

    public static TransferReceipt failed(String recipient, BigInteger amount, String reason) {
        return new TransferReceipt(false, recipient, amount, null, reason);
    }
}
