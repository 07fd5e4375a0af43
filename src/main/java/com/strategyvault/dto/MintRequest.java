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
public class MintRequest {

    @NotNull(message = "Share amount is required")
    @Positive(message = "Share amount must be positive")
    private BigInteger shares;

    private String receiver; // defaults to the caller
}
