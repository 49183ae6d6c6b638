package com.storeforecast.dto;

public enum FitStatus {
    GOOD,
    OVERFITTING,
    UNDERFITTING,
    UNKNOWN
}
