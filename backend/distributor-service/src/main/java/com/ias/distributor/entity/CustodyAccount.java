package com.ias.distributor.entity;

import jakarta.persistence.*;
import lombok.*;
import java.math.BigInteger;
import java.time.LocalDateTime;

/**
 * Balance held by an account in the custody asset ledger
 */
@Entity
@Table(name = "custody_accounts")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CustodyAccount {

    @Id
    @Column(name = "account_address", length = 42)
    private String accountAddress;

    @Column(nullable = false, precision = 78, scale = 0)
    @Builder.Default
    private BigInteger balance = BigInteger.ZERO;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = LocalDateTime.now();
    }
}
