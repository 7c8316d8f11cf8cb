package com.ias.distributor.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for rotating the authority identity
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TransferAuthorityRequest {

    @NotBlank(message = "New authority address is required")
    @Pattern(regexp = "^0x[a-fA-F0-9]{40}$", message = "Invalid Ethereum address format")
    private String newAuthority;
}
