package com.storeforecast.exception;

import lombok.Getter;

@Getter
public abstract class ForecastPipelineException extends RuntimeException {
    private final String errorCode;
    protected ForecastPipelineException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    protected ForecastPipelineException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
