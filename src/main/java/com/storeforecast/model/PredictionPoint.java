package com.storeforecast.model;

import java.time.LocalDate;

public record PredictionPoint(LocalDate date, double yhat, double yhatLower, double yhatUpper) {

    public PredictionPoint withValues(double yhat, double yhatLower, double yhatUpper) {
        return new PredictionPoint(date, yhat, yhatLower, yhatUpper);
    }
}
