package com.ias.distributor.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class EmergencyWithdrawRequest {

    @NotNull(message = "Amount is required")
    private BigInteger amount;
}
