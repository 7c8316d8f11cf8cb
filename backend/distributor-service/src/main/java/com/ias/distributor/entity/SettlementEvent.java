package com.ias.distributor.entity;

import jakarta.persistence.*;
import lombok.*;
import java.math.BigInteger;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Append-only audit record for settlements and administrative actions
 */
@Entity
@Table(name = "settlement_events", indexes = {
    @Index(name = "idx_settlement_event_affiliate", columnList = "affiliate_address"),
    @Index(name = "idx_settlement_event_epoch", columnList = "epoch")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SettlementEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32, updatable = false)
    private SettlementEventType type;

    @Column(name = "affiliate_address", length = 42, updatable = false)
    private String affiliateAddress;

    @Column(precision = 78, scale = 0, updatable = false)
    private BigInteger amount;

    @Column(updatable = false)
    private Long epoch;

    @Enumerated(EnumType.STRING)
    @Column(length = 16, updatable = false)
    private SettlementPath path;

    @Column(name = "recipient_count", updatable = false)
    private Integer recipientCount;

    @Column(name = "transfer_reference", length = 128, updatable = false)
    private String transferReference;

    @Column(length = 255, updatable = false)
    private String detail;

    @Column(name = "created_at", nullable = false, updatable = false)
    @Builder.Default
    private LocalDateTime createdAt = LocalDateTime.now();
}
