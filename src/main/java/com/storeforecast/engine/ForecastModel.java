package com.storeforecast.engine;

import com.storeforecast.model.FeatureFrame;
import com.storeforecast.model.PredictionFrame;

import java.util.List;

/**
 * A fitted regression model. Predictions are on the scale the model was trained on.
 */
public interface ForecastModel {

    /** Regressor columns registered at fit time, in registration order. */
    List<String> regressors();

    /**
     * @throws IllegalArgumentException when the frame lacks a registered regressor column
     */
    PredictionFrame predict(FeatureFrame frame);
}
