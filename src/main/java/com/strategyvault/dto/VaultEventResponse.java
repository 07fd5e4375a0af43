package com.strategyvault.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class VaultEventResponse {
    private Long id;
    private String eventType;
    private String holder;
    private String description;
    private Instant timestamp;
}
