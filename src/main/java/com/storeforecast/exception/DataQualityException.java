package com.storeforecast.exception;

public class DataQualityException extends ForecastPipelineException {
    public DataQualityException(String message) {
        super("DATA_QUALITY", message);
    }
}
