package com.ias.distributor.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.util.List;

/**
 * DTO for distributor ledger overview
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LedgerInfoDto {

    private String ledgerAddress;
    private String authorityAddress;
    private String assetReference;
    private BigInteger globalTotal;
    /** Null when the active asset reference cannot be resolved. */
    private BigInteger custodiedBalance;
    private List<String> availableAssetReferences;
}
