package com.storeforecast.model;

public enum SynthesisMode {
    /** Statistics come only from history strictly before the first target date. */
    VALIDATION,
    /** Statistics come from the whole history up to today. */
    FORECAST
}
