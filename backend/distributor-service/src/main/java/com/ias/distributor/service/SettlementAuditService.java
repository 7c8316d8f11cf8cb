package com.ias.distributor.service;

import com.ias.distributor.dto.SettlementEventDto;
import com.ias.distributor.entity.SettlementEvent;
import com.ias.distributor.entity.SettlementEventType;
import com.ias.distributor.entity.SettlementPath;
import com.ias.distributor.repository.SettlementEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.math.BigInteger;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Append-only audit trail. Records are written in the settling transaction, so they exist
 * exactly when the settlement commits. Lines on the out-of-band audit log are emitted only
 * once that transaction has committed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SettlementAuditService {

    /** Separate appender; see logback-spring.xml. */
    static final Logger AUDIT = LoggerFactory.getLogger("distributor.audit");

    private final SettlementEventRepository eventRepository;

    @Transactional(propagation = Propagation.MANDATORY)
    public void rewardDistributed(String affiliate, BigInteger amount, long epoch, String transferReference) {
        append(SettlementEvent.builder()
                .type(SettlementEventType.REWARD_DISTRIBUTED)
                .affiliateAddress(affiliate)
                .amount(amount)
                .epoch(epoch)
                .path(SettlementPath.BATCH)
                .transferReference(transferReference)
                .build());
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void batchDistributed(int recipientCount, BigInteger totalAmount, long epoch) {
        append(SettlementEvent.builder()
                .type(SettlementEventType.BATCH_REWARD_DISTRIBUTED)
                .amount(totalAmount)
                .epoch(epoch)
                .path(SettlementPath.BATCH)
                .recipientCount(recipientCount)
                .build());
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void rewardClaimed(String affiliate, BigInteger amount, long epoch, String transferReference) {
        append(SettlementEvent.builder()
                .type(SettlementEventType.REWARD_CLAIMED)
                .affiliateAddress(affiliate)
                .amount(amount)
                .epoch(epoch)
                .path(SettlementPath.CLAIM)
                .transferReference(transferReference)
                .build());
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void emergencyWithdrawal(String authority, BigInteger amount, String transferReference) {
        afterCommit(() -> AUDIT.warn("EMERGENCY_WITHDRAWAL authority={} amount={} transfer={}",
                authority, amount, transferReference));
        append(SettlementEvent.builder()
                .type(SettlementEventType.EMERGENCY_WITHDRAWAL)
                .affiliateAddress(authority)
                .amount(amount)
                .transferReference(transferReference)
                .detail("bypasses per-epoch bookkeeping")
                .build());
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void ledgerFunded(String ledger, BigInteger amount, String transferReference) {
        afterCommit(() -> AUDIT.info("LEDGER_FUNDED ledger={} amount={} transfer={}",
                ledger, amount, transferReference));
        append(SettlementEvent.builder()
                .type(SettlementEventType.LEDGER_FUNDED)
                .affiliateAddress(ledger)
                .amount(amount)
                .transferReference(transferReference)
                .build());
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void assetReferenceUpdated(String previous, String current) {
        afterCommit(() -> AUDIT.info("ASSET_REFERENCE_UPDATED from={} to={}", previous, current));
        append(SettlementEvent.builder()
                .type(SettlementEventType.ASSET_REFERENCE_UPDATED)
                .detail(previous + " -> " + current)
                .build());
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void authorityTransferred(String previous, String current) {
        afterCommit(() -> AUDIT.info("AUTHORITY_TRANSFERRED from={} to={}", previous, current));
        append(SettlementEvent.builder()
                .type(SettlementEventType.AUTHORITY_TRANSFERRED)
                .affiliateAddress(current)
                .detail(previous + " -> " + current)
                .build());
    }

    // ==================== Queries ====================

    @Transactional(readOnly = true)
    public List<SettlementEventDto> recentEvents() {
        return toDtos(eventRepository.findTop100ByOrderByCreatedAtDesc());
    }

    @Transactional(readOnly = true)
    public List<SettlementEventDto> eventsFor(String affiliate) {
        return toDtos(eventRepository.findByAffiliateAddressOrderByCreatedAtDesc(affiliate.toLowerCase()));
    }

    private static void afterCommit(Runnable record) {
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                record.run();
            }
        });
    }

    private void append(SettlementEvent event) {
        eventRepository.save(event);
        log.info("{} affiliate={} amount={} epoch={}",
                event.getType(), event.getAffiliateAddress(), event.getAmount(), event.getEpoch());
    }

    private static List<SettlementEventDto> toDtos(List<SettlementEvent> events) {
        return events.stream()
                .map(e -> SettlementEventDto.builder()
                        .id(e.getId())
                        .type(e.getType())
                        .affiliate(e.getAffiliateAddress())
                        .amount(e.getAmount())
                        .epoch(e.getEpoch())
                        .path(e.getPath())
                        .recipientCount(e.getRecipientCount())
                        .transferReference(e.getTransferReference())
                        .createdAt(e.getCreatedAt())
                        .build())
                .collect(Collectors.toList());
    }
}
