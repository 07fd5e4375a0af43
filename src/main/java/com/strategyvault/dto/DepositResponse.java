package com.strategyvault.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DepositResponse {
    private String caller;
    private String receiver;
    private BigInteger assets;
    private BigInteger shares;
    private BigInteger shareBalance;
}
