package com.storeforecast.exception;

import java.util.UUID;

public class JobNotFoundException extends ForecastPipelineException {
    public JobNotFoundException(UUID jobId) {
        super("JOB_NOT_FOUND", "Training job with id '" + jobId + "' not found.");
    }
}
