package com.ias.distributor.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.util.List;

/**
 * Request DTO for a batch distribution. Lists are parallel: amounts[i] goes to affiliates[i].
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BatchDistributionRequest {

    @NotNull(message = "Affiliates are required")
    private List<String> affiliates;

    @NotNull(message = "Amounts are required")
    private List<BigInteger> amounts;

    @NotNull(message = "Epoch is required")
    private Long epoch;
}
