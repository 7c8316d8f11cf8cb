package com.ias.distributor.dto;

import com.ias.distributor.entity.SettlementPath;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.util.List;

/**
 * Result of a committed settlement
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SettlementResult {

    private SettlementPath path;
    private long epoch;
    private List<String> recipients;
    private BigInteger totalAmount;
    private List<String> transferReferences;
}
