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
public class DepositRequest {

    @NotNull(message = "Asset amount is required")
    @Positive(message = "Asset amount must be positive")
    private BigInteger assets; // base units

    private String receiver; // defaults to the caller
}
