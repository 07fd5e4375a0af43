package com.strategyvault.dto;

import com.strategyvault.model.StrategyKind;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AddStrategyRequest {

    @NotBlank(message = "Strategy address is required")
    private String address;

    @NotNull(message = "Allocation is required")
    @Min(value = 0, message = "Allocation cannot be negative")
    @Max(value = 10000, message = "Allocation cannot exceed 10000 bps")
    private Integer allocationBps;

    @NotNull(message = "Strategy kind is required")
    private StrategyKind kind; // CONVERTIBLE or DIRECT

    private Boolean hasLockup; // informational (default: false)
}
