package com.ias.distributor.service;

import com.ias.distributor.crypto.Addresses;
import com.ias.distributor.crypto.AuthorizationToken;
import com.ias.distributor.crypto.AuthorizationVerifier;
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
import java.util.List;

/**
 * Affiliate-driven pull path, gated by an authority signature
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RewardClaimService {

    private final LedgerStateService ledgerStateService;
    private final AuthorizationVerifier authorizationVerifier;
    private final AssetGatewayRegistry gatewayRegistry;
    private final SettlementAuditService auditService;

    /**
     * Claim {@code amount} for {@code epoch} on behalf of the calling affiliate
     */
    @Transactional
    public SettlementResult claim(String caller, BigInteger amount, long epoch, String signature) {
        String affiliate = Addresses.normalize(caller);

        if (amount == null || amount.signum() <= 0) {
            throw new DistributionException(ErrorCode.INVALID_AMOUNT, "Amount must be greater than zero");
        }
        if (epoch < 0) {
            throw new DistributionException(ErrorCode.INVALID_EPOCH, "Epoch must not be negative");
        }

        DistributorState state = ledgerStateService.lockLedger();

        if (ledgerStateService.hasClaimed(affiliate, epoch)) {
            log.warn("Repeated claim by {} for epoch {}", affiliate, epoch);
            throw new DistributionException(ErrorCode.ALREADY_CLAIMED,
                    "Reward already claimed for epoch " + epoch);
        }

        authorizationVerifier.verify(new AuthorizationToken(affiliate, amount, epoch, signature),
                state.getLedgerAddress(), state.getAuthorityAddress());

        AssetTransferGateway gateway = gatewayRegistry.require(state.getAssetReference());
        BigInteger balance = gateway.balanceOf(state.getLedgerAddress());
        if (balance.compareTo(amount) < 0) {
            throw new DistributionException(ErrorCode.INSUFFICIENT_BALANCE,
                    "Insufficient balance: claim needs " + amount + ", ledger holds " + balance);
        }

        ledgerStateService.recordSettlement(affiliate, epoch, amount, SettlementPath.CLAIM);

        TransferReceipt receipt = gateway.transfer(state.getLedgerAddress(), affiliate, amount);
        if (!receipt.isSuccess()) {
            log.error("Claim transfer of {} to {} for epoch {} failed: {}",
                    amount, affiliate, epoch, receipt.getFailureReason());
            throw new DistributionException(ErrorCode.TRANSFER_FAILED,
                    "Transfer to " + affiliate + " failed: " + receipt.getFailureReason());
        }
        auditService.rewardClaimed(affiliate, amount, epoch, receipt.getReference());

        log.info("Affiliate {} claimed {} for epoch {}", affiliate, amount, epoch);

        return SettlementResult.builder()
                .path(SettlementPath.CLAIM)
                .epoch(epoch)
                .recipients(List.of(affiliate))
                .totalAmount(amount)
                .transferReferences(List.of(receipt.getReference()))
                .build();
    }
}
