package com.strategyvault.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WithdrawRequest {

    @NotNull(message = "Asset amount is required")
    @Positive(message = "Asset amount must be positive")
    private BigInteger assets;

    private String receiver; // defaults to the caller

    private String owner; // defaults to the caller; otherwise the caller spends a share allowance
}
