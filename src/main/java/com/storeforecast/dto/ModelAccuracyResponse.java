package com.storeforecast.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.storeforecast.model.AccuracyStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ModelAccuracyResponse {
    String storeId;
    String modelVersion;
    AccuracyStatus accuracyStatus;
    Double accuracy;
    Double trainMape;
    Double validationMape;
    Double errorGap;
    /** True when the MAPE values were derived from the stored accuracy rather than recorded. */
    boolean mapeEstimated;
    FitStatus fitStatus;
    int validationDays;
    int dataPoints;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant lastTrained;
    AccuracyStatus actualDataStatus;
    Double actualDataMape;
    Double actualDataAccuracy;
}
