package com.storeforecast.exception;

public class ForecastFailedException extends ForecastPipelineException {

    public static ForecastFailedException training(String storeId, Throwable cause) {
        return new ForecastFailedException("TRAINING_FAILED",
            "Training failed for store '" + storeId + "': " + describe(cause), cause);
    }

    public static ForecastFailedException prediction(String storeId, Throwable cause) {
        return new ForecastFailedException("PREDICTION_FAILED",
            "Prediction failed for store '" + storeId + "': " + describe(cause), cause);
    }

    private ForecastFailedException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
