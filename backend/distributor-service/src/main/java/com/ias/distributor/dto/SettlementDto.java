package com.ias.distributor.dto;

import com.ias.distributor.entity.SettlementPath;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * DTO for one settled (affiliate, epoch) pair
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SettlementDto {

    private UUID id;
    private String affiliate;
    private long epoch;
    private BigInteger amount;
    private SettlementPath path;
    private LocalDateTime settledAt;
}
