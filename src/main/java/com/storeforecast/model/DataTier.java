package com.storeforecast.model;

public enum DataTier {
    SHORT,
    MEDIUM,
    LONG
}
