package com.storeforecast.model;

public enum EvaluationOutcome {
    NO_MODEL,
    SKIPPED,
    GOOD,
    RETRAINED
}
