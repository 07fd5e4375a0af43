package com.strategyvault.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ShareApprovalRequest {

    @NotBlank(message = "Spender is required")
    private String spender;

    @NotNull(message = "Share amount is required")
    @PositiveOrZero(message = "Share amount cannot be negative")
    private BigInteger shares;
}
