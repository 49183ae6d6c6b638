package com.storeforecast.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/** Per-column standardization fitted on a training window. */
@Value
@Builder
@Jacksonized
public class ScalerParams {
    public static final String CURRENT_VERSION = "2.0";

    @Singular("column")
    List<String> columns;
    @Singular("mean")
    Map<String, Double> means;
    @Singular("scale")
    Map<String, Double> scales;
    @Builder.Default
    String version = CURRENT_VERSION;
}
