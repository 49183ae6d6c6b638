package com.storeforecast.dto;

public enum RiskLevel {
    HIGH,
    MEDIUM,
    LOW
}
