package com.ias.distributor.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateAssetReferenceRequest {

    @NotBlank(message = "Asset reference is required")
    private String handle;
}
