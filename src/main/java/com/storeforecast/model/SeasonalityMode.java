package com.storeforecast.model;

public enum SeasonalityMode {
    ADDITIVE,
    MULTIPLICATIVE
}
