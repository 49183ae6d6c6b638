package com.storeforecast.exception;

public class ModelStoreException extends ForecastPipelineException {
    public ModelStoreException(String message) {
        super("MODEL_STORE_ERROR", message);
    }
    public ModelStoreException(String message, Throwable cause) {
        super("MODEL_STORE_ERROR", message, cause);
    }
}
