package com.strategyvault.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AllocationUpdateRequest {

    @NotNull(message = "Allocation is required")
    @Min(value = 0, message = "Allocation cannot be negative")
    @Max(value = 10000, message = "Allocation cannot exceed 10000 bps")
    private Integer allocationBps;
}
