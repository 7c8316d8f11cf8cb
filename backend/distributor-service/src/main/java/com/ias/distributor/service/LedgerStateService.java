package com.ias.distributor.service;

import com.ias.distributor.crypto.Addresses;
import com.ias.distributor.dto.LedgerInfoDto;
import com.ias.distributor.dto.SettlementDto;
import com.ias.distributor.entity.*;
import com.ias.distributor.exception.DistributionException;
import com.ias.distributor.exception.ErrorCode;
import com.ias.distributor.gateway.AssetGatewayRegistry;
import com.ias.distributor.repository.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Authoritative record of settled (affiliate, epoch) pairs and running totals
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerStateService {

    private final DistributorStateRepository stateRepository;
    private final RewardClaimRepository claimRepository;
    private final AffiliateTotalRepository totalRepository;
    private final AssetGatewayRegistry gatewayRegistry;

    // ==================== Locking ====================

    /**
     * Take the ledger row lock for the rest of the current transaction
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public DistributorState lockLedger() {
        return stateRepository.findByIdForUpdate(DistributorState.SINGLETON_ID)
                .orElseThrow(() -> new DistributionException(ErrorCode.LEDGER_NOT_INITIALIZED,
                        "Distributor ledger has not been initialized"));
    }

    // ==================== Settlement ====================

    /**
     * Mark (affiliate, epoch) as claimed and add the amount to both totals.
     * Runs inside the caller's transaction, which must already hold the ledger lock.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public RewardClaim recordSettlement(String affiliate, long epoch, BigInteger amount, SettlementPath path) {
        String normalizedAffiliate = Addresses.normalize(affiliate);
        DistributorState state = lockLedger();

        if (claimRepository.existsByAffiliateAddressAndEpoch(normalizedAffiliate, epoch)) {
            throw new DistributionException(ErrorCode.ALREADY_CLAIMED,
                    "Reward already claimed for " + normalizedAffiliate + " in epoch " + epoch);
        }

        RewardClaim claim = claimRepository.save(RewardClaim.builder()
                .affiliateAddress(normalizedAffiliate)
                .epoch(epoch)
                .amount(amount)
                .path(path)
                .build());

        AffiliateTotal total = totalRepository.findById(normalizedAffiliate)
                .orElseGet(() -> AffiliateTotal.builder()
                        .affiliateAddress(normalizedAffiliate)
                        .build());
        total.add(amount);
        totalRepository.save(total);

        state.setGlobalTotal(state.getGlobalTotal().add(amount));
        stateRepository.save(state);

        log.debug("Recorded {} settlement of {} to {} for epoch {}", path, amount, normalizedAffiliate, epoch);
        return claim;
    }

    // ==================== Queries ====================

    @Transactional(readOnly = true)
    public boolean hasClaimed(String affiliate, long epoch) {
        return claimRepository.existsByAffiliateAddressAndEpoch(Addresses.normalize(affiliate), epoch);
    }

    @Transactional(readOnly = true)
    public BigInteger affiliateTotal(String affiliate) {
        return totalRepository.findById(Addresses.normalize(affiliate))
                .map(AffiliateTotal::getTotalDistributed)
                .orElse(BigInteger.ZERO);
    }

    @Transactional(readOnly = true)
    public BigInteger globalTotal() {
        return stateRepository.findById(DistributorState.SINGLETON_ID)
                .map(DistributorState::getGlobalTotal)
                .orElse(BigInteger.ZERO);
    }

    /**
     * Settlement history for an affiliate, newest first
     */
    @Transactional(readOnly = true)
    public List<SettlementDto> settlements(String affiliate) {
        return claimRepository.findByAffiliateAddressOrderBySettledAtDesc(Addresses.normalize(affiliate)).stream()
                .map(c -> SettlementDto.builder()
                        .id(c.getId())
                        .affiliate(c.getAffiliateAddress())
                        .epoch(c.getEpoch())
                        .amount(c.getAmount())
                        .path(c.getPath())
                        .settledAt(c.getSettledAt())
                        .build())
                .collect(Collectors.toList());
    }

    /**
     * Asset balance held by any account on the active asset gateway
     */
    @Transactional(readOnly = true)
    public BigInteger walletBalance(String account) {
        String normalized = Addresses.normalize(account);
        DistributorState state = currentState();
        return gatewayRegistry.require(state.getAssetReference()).balanceOf(normalized);
    }

    @Transactional(readOnly = true)
    public LedgerInfoDto ledgerInfo() {
        DistributorState state = currentState();

        BigInteger custodied = gatewayRegistry.find(state.getAssetReference())
                .map(g -> g.balanceOf(state.getLedgerAddress()))
                .orElse(null);

        return LedgerInfoDto.builder()
                .ledgerAddress(state.getLedgerAddress())
                .authorityAddress(state.getAuthorityAddress())
                .assetReference(state.getAssetReference())
                .globalTotal(state.getGlobalTotal())
                .custodiedBalance(custodied)
                .availableAssetReferences(List.copyOf(gatewayRegistry.handles()))
                .build();
    }

    private DistributorState currentState() {
        return stateRepository.findById(DistributorState.SINGLETON_ID)
                .orElseThrow(() -> new DistributionException(ErrorCode.LEDGER_NOT_INITIALIZED,
                        "Distributor ledger has not been initialized"));
    }
}
