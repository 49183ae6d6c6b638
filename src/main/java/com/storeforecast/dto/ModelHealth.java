package com.storeforecast.dto;

public enum ModelHealth {
    NO_MODEL,
    HEALTHY,
    NEEDS_RETRAIN
}
