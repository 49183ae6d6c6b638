package com.storeforecast.model;

public enum OutlierPolicy {
    /** Clamp the target into the configured percentile band of the window. */
    CLIP,
    /** Drop rows whose target z-score exceeds the configured threshold. */
    REMOVE,
    NONE
}
