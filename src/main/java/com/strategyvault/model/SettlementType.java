package com.strategyvault.model;

public enum SettlementType {
    IMMEDIATE,
    QUEUED
}
