package com.ias.distributor.gateway;

import java.math.BigInteger;

/**
 * Handle on the external ledger that holds and moves the reward asset.
 * The caller names the debited account, which is always the distributor's persisted ledger identity.
 */
public interface AssetTransferGateway {

    /**
     * Stable name under which this gateway can be selected as the active asset reference
     */
    String handle();

    TransferReceipt transfer(String from, String to, BigInteger amount);

    /**
     * Credit {@code account} from outside the distributor. Gateways whose ledger is funded by
     * its own means return a failed receipt.
     */
    TransferReceipt deposit(String account, BigInteger amount);

    BigInteger balanceOf(String account);
}
