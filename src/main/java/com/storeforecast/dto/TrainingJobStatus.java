package com.storeforecast.dto;

public enum TrainingJobStatus {
    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED
}
