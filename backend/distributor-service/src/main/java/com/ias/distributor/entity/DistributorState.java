package com.ias.distributor.entity;

import jakarta.persistence.*;
import lombok.*;
import java.math.BigInteger;
import java.time.LocalDateTime;

/**
 * Singleton ledger row. Mutating operations lock it first, so it doubles as the
 * serialization point for settlement and balance checks.
 */
@Entity
@Table(name = "distributor_state")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DistributorState {

    public static final long SINGLETON_ID = 1L;

    @Id
    @Builder.Default
    private Long id = SINGLETON_ID;

    /** Identity of this ledger instance, bound into every claim signature. */
    @Column(name = "ledger_address", nullable = false, length = 42)
    private String ledgerAddress;

    @Column(name = "authority_address", nullable = false, length = 42)
    private String authorityAddress;

    @Column(name = "asset_reference", nullable = false, length = 64)
    private String assetReference;

    @Column(name = "global_total", nullable = false, precision = 78, scale = 0)
    @Builder.Default
    private BigInteger globalTotal = BigInteger.ZERO;

    @Column(name = "created_at", nullable = false)
    @Builder.Default
    private LocalDateTime createdAt = LocalDateTime.now();

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = LocalDateTime.now();
    }
}
