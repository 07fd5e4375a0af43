package com.strategyvault.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DeployStrategyRequest {

    @NotBlank(message = "Strategy address is required")
    private String address;

    private String name;

    private boolean lockable; // supports lock/unlock of redemptions
}
