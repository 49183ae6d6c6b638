package com.storeforecast.exception;

public class ScalerException extends ForecastPipelineException {
    public ScalerException(String message) {
        super("SCALER_ERROR", message);
    }
}
