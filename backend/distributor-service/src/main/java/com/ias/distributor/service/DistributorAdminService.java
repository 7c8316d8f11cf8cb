package com.ias.distributor.service;

import com.ias.distributor.crypto.Addresses;
import com.ias.distributor.entity.DistributorState;
import com.ias.distributor.exception.DistributionException;
import com.ias.distributor.exception.ErrorCode;
import com.ias.distributor.gateway.AssetGatewayRegistry;
import com.ias.distributor.gateway.AssetTransferGateway;
import com.ias.distributor.gateway.TransferReceipt;
import com.ias.distributor.repository.DistributorStateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;

/**
 * Authority-only operations
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DistributorAdminService {

    private final LedgerStateService ledgerStateService;
    private final DistributorStateRepository stateRepository;
    private final AssetGatewayRegistry gatewayRegistry;
    private final SettlementAuditService auditService;
    private final AuthorityGuard authorityGuard;

    /**
     * Point the ledger at another asset gateway
     */
    @Transactional
    public void updateAssetReference(String caller, String handle) {
        DistributorState state = ledgerStateService.lockLedger();
        authorityGuard.requireAuthority(caller, state);

        gatewayRegistry.require(handle);

        String previous = state.getAssetReference();
        state.setAssetReference(handle);
        stateRepository.save(state);
        auditService.assetReferenceUpdated(previous, handle);
    }

    /**
     * Move custodied funds to the authority without touching per-epoch bookkeeping
     */
    @Transactional
    public String emergencyWithdraw(String caller, BigInteger amount) {
        DistributorState state = ledgerStateService.lockLedger();
        String authority = authorityGuard.requireAuthority(caller, state);

        if (amount == null || amount.signum() <= 0) {
            throw new DistributionException(ErrorCode.INVALID_AMOUNT, "Amount must be greater than zero");
        }

        AssetTransferGateway gateway = gatewayRegistry.require(state.getAssetReference());
        BigInteger balance = gateway.balanceOf(state.getLedgerAddress());
        if (balance.compareTo(amount) < 0) {
            throw new DistributionException(ErrorCode.INSUFFICIENT_BALANCE,
                    "Insufficient balance: withdrawal needs " + amount + ", ledger holds " + balance);
        }

        TransferReceipt receipt = gateway.transfer(state.getLedgerAddress(), authority, amount);
        if (!receipt.isSuccess()) {
            throw new DistributionException(ErrorCode.TRANSFER_FAILED,
                    "Emergency withdrawal failed: " + receipt.getFailureReason());
        }
        auditService.emergencyWithdrawal(authority, amount, receipt.getReference());
        return receipt.getReference();
    }

    /**
     * Credit the ledger's custody through the active gateway
     */
    @Transactional
    public String depositToLedger(String caller, BigInteger amount) {
        DistributorState state = ledgerStateService.lockLedger();
        authorityGuard.requireAuthority(caller, state);

        if (amount == null || amount.signum() <= 0) {
            throw new DistributionException(ErrorCode.INVALID_AMOUNT, "Amount must be greater than zero");
        }

        AssetTransferGateway gateway = gatewayRegistry.require(state.getAssetReference());
        TransferReceipt receipt = gateway.deposit(state.getLedgerAddress(), amount);
        if (!receipt.isSuccess()) {
            throw new DistributionException(ErrorCode.TRANSFER_FAILED,
                    "Deposit into " + state.getLedgerAddress() + " failed: " + receipt.getFailureReason());
        }
        auditService.ledgerFunded(state.getLedgerAddress(), amount, receipt.getReference());
        log.info("Ledger {} funded with {} via {}", state.getLedgerAddress(), amount, gateway.handle());
        return receipt.getReference();
    }

    /**
     * Rotate the authority identity. Outstanding signatures from the previous authority stop verifying.
     */
    @Transactional
    public void transferAuthority(String caller, String newAuthority) {
        DistributorState state = ledgerStateService.lockLedger();
        authorityGuard.requireAuthority(caller, state);

        String next = Addresses.normalize(newAuthority);
        String previous = state.getAuthorityAddress();
        state.setAuthorityAddress(next);
        stateRepository.save(state);
        auditService.authorityTransferred(previous, next);
    }
}
