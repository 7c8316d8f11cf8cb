package com.ias.distributor.service;

import com.ias.distributor.config.DistributorProperties;
import com.ias.distributor.crypto.Addresses;
import com.ias.distributor.dto.SettlementResult;
import com.ias.distributor.entity.DistributorState;
import com.ias.distributor.entity.SettlementPath;
import com.ias.distributor.exception.DistributionException;
import com.ias.distributor.exception.ErrorCode;
import com.ias.distributor.gateway.AssetGatewayRegistry;
import com.ias.distributor.gateway.AssetTransferGateway;
import com.ias.distributor.gateway.TransferReceipt;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Operator-driven push path: settles a whole batch of affiliates for one epoch, or none of them
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BatchDistributionService {

    private final LedgerStateService ledgerStateService;
    private final AssetGatewayRegistry gatewayRegistry;
    private final SettlementAuditService auditService;
    private final AuthorityGuard authorityGuard;
    private final DistributorProperties properties;

    /**
     * Distribute {@code amounts[i]} to {@code affiliates[i]} for the given epoch.
     * Any already-claimed pair, including a repeat within the batch, aborts the whole batch.
     */
    @Transactional
    public SettlementResult batchDistribute(String caller, List<String> affiliates, List<BigInteger> amounts,
                                            long epoch) {
        DistributorState state = ledgerStateService.lockLedger();
        authorityGuard.requireAuthority(caller, state);

        List<String> recipients = validateBatch(affiliates, amounts, epoch);
        BigInteger total = amounts.stream().reduce(BigInteger.ZERO, BigInteger::add);

        AssetTransferGateway gateway = gatewayRegistry.require(state.getAssetReference());
        BigInteger balance = gateway.balanceOf(state.getLedgerAddress());
        if (balance.compareTo(total) < 0) {
            throw new DistributionException(ErrorCode.INSUFFICIENT_BALANCE,
                    "Insufficient balance: batch needs " + total + ", ledger holds " + balance);
        }

        log.info("Starting batch distribution for epoch {}: {} recipients, total {}", epoch, recipients.size(), total);

        // Bookkeeping for every entry commits before any value moves
        for (int i = 0; i < recipients.size(); i++) {
            ledgerStateService.recordSettlement(recipients.get(i), epoch, amounts.get(i), SettlementPath.BATCH);
        }

        List<String> references = new ArrayList<>(recipients.size());
        for (int i = 0; i < recipients.size(); i++) {
            TransferReceipt receipt = gateway.transfer(state.getLedgerAddress(), recipients.get(i), amounts.get(i));
            if (!receipt.isSuccess()) {
                log.error("Transfer {} of {} in epoch {} batch failed after {} delivered: {}",
                        i, recipients.get(i), epoch, references, receipt.getFailureReason());
                throw new DistributionException(ErrorCode.TRANSFER_FAILED,
                        "Transfer to " + recipients.get(i) + " failed: " + receipt.getFailureReason());
            }
            references.add(receipt.getReference());
            auditService.rewardDistributed(recipients.get(i), amounts.get(i), epoch, receipt.getReference());
        }
        auditService.batchDistributed(recipients.size(), total, epoch);

        log.info("Batch distribution for epoch {} completed: {} recipients, total {}", epoch, recipients.size(), total);

        return SettlementResult.builder()
                .path(SettlementPath.BATCH)
                .epoch(epoch)
                .recipients(recipients)
                .totalAmount(total)
                .transferReferences(references)
                .build();
    }

    private List<String> validateBatch(List<String> affiliates, List<BigInteger> amounts, long epoch) {
        if (affiliates == null || amounts == null || affiliates.isEmpty()) {
            throw invalidBatch("batch is empty");
        }
        if (affiliates.size() != amounts.size()) {
            throw invalidBatch("affiliates and amounts must have the same length ("
                    + affiliates.size() + " vs " + amounts.size() + ")");
        }
        if (affiliates.size() > properties.getMaxBatchSize()) {
            throw invalidBatch("batch exceeds " + properties.getMaxBatchSize() + " entries");
        }
        if (epoch < 0) {
            throw invalidBatch("epoch must not be negative");
        }

        List<String> recipients = new ArrayList<>(affiliates.size());
        for (int i = 0; i < affiliates.size(); i++) {
            if (!Addresses.isValid(affiliates.get(i))) {
                throw invalidBatch("entry " + i + " has an invalid address");
            }
            BigInteger amount = amounts.get(i);
            if (amount == null || amount.signum() <= 0) {
                throw invalidBatch("entry " + i + " has a non-positive amount");
            }
            recipients.add(affiliates.get(i).toLowerCase());
        }
        return recipients;
    }

    private static DistributionException invalidBatch(String reason) {
        return new DistributionException(ErrorCode.INVALID_BATCH, "Invalid batch: " + reason);
    }
}
