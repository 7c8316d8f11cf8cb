package com.ias.distributor.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * Request DTO for claiming a signed reward
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ClaimRewardRequest {

    @NotNull(message = "Amount is required")
    private BigInteger amount;

    @NotNull(message = "Epoch is required")
    private Long epoch;

    @NotBlank(message = "Signature is required")
    private String signature;
}
