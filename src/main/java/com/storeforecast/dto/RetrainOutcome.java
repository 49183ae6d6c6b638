package com.storeforecast.dto;

public enum RetrainOutcome {
    RETRAINED,
    UP_TO_DATE
}
