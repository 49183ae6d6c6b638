package com.storeforecast.model;

import com.storeforecast.engine.ForecastModel;

/** An artifact together with the metadata written in the same version. */
public record TrainedModel(ForecastModel model, ModelMetadata metadata) {
}
