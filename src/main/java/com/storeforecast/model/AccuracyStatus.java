package com.storeforecast.model;

public enum AccuracyStatus {
    COMPUTED,
    INSUFFICIENT_DATA,
    COMPUTATION_ERROR
}
