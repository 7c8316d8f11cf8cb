package com.ias.distributor.entity;

import jakarta.persistence.*;
import lombok.*;
import java.math.BigInteger;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Settled (affiliate, epoch) pair. A row exists once the pair is claimed and is never updated.
 */
@Entity
@Table(name = "reward_claims", uniqueConstraints = {
    @UniqueConstraint(name = "u_reward_claim_affiliate_epoch", columnNames = {"affiliate_address", "epoch"})
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RewardClaim {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "affiliate_address", nullable = false, length = 42, updatable = false)
    private String affiliateAddress;

    @Column(nullable = false, updatable = false)
    private Long epoch;

    @Column(nullable = false, precision = 78, scale = 0, updatable = false)
    private BigInteger amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16, updatable = false)
    private SettlementPath path;

    @Column(name = "settled_at", nullable = false, updatable = false)
    @Builder.Default
    private LocalDateTime settledAt = LocalDateTime.now();
}
