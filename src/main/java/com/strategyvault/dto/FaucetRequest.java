package com.strategyvault.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FaucetRequest {

    @NotBlank(message = "Account is required")
    private String account;

    @Positive(message = "Amount must be positive")
    private long amount; // whole tokens
}
