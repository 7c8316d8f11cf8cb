package com.ias.distributor.dto;

import com.ias.distributor.entity.SettlementEventType;
import com.ias.distributor.entity.SettlementPath;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * DTO for audit trail entries
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SettlementEventDto {

    private UUID id;
    private SettlementEventType type;
    private String affiliate;
    private BigInteger amount;
    private Long epoch;
    private SettlementPath path;
    private Integer recipientCount;
    private String transferReference;
    private LocalDateTime createdAt;
}
