package com.ias.distributor.entity;

import jakarta.persistence.*;
import lombok.*;
import java.math.BigInteger;
import java.time.LocalDateTime;

/**
 * Cumulative amount settled to one affiliate across all epochs
 */
@Entity
@Table(name = "affiliate_totals")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AffiliateTotal {

    @Id
    @Column(name = "affiliate_address", length = 42)
    private String affiliateAddress;

    @Column(name = "total_distributed", nullable = false, precision = 78, scale = 0)
    @Builder.Default
    private BigInteger totalDistributed = BigInteger.ZERO;

    @Column(name = "settlement_count", nullable = false)
    @Builder.Default
    private Integer settlementCount = 0;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public void add(BigInteger amount) {
        this.totalDistributed = this.totalDistributed.add(amount);
        this.settlementCount = this.settlementCount + 1;
        this.updatedAt = LocalDateTime.now();
    }
}
