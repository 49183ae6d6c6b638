package com.storeforecast.engine;

import com.storeforecast.model.EngineParams;
import com.storeforecast.model.FeatureFrame;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Map;

/**
 * Seam to the additive regression engine.
 */
public interface RegressionEngine {

    /**
     * Fits on the {@code y} column of the frame. Every key of {@code regressorPriorScales} is
     * registered as a regressor and must be a column of the frame.
     */
    ForecastModel fit(FeatureFrame training, EngineParams params, Map<String, Double> regressorPriorScales);

    void write(ForecastModel model, OutputStream out) throws IOException;

    ForecastModel read(InputStream in) throws IOException;
}
