package com.storeforecast.exception;

public class InvalidForecastRequestException extends ForecastPipelineException {
    public InvalidForecastRequestException(String message) {
        super("INVALID_FORECAST_REQUEST", message);
    }
}
