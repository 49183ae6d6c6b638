package com.storeforecast.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Everything needed to reproduce a prediction with the artifact of the same version.
 * Written next to the artifact as {@code metadata.json}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ModelMetadata {
    String modelVersion;
    String storeId;
    int trainingWindowDays;
    int dataPoints;
    LocalDate startDate;
    LocalDate endDate;
    boolean logTransform;
    OutlierPolicy outlierPolicy;
    boolean smoothingApplied;
    int smoothingWindow;
    ScalerParams scalerParams;
    List<String> regressors;
    Map<String, Double> regressorPriorScales;
    EngineParams engineParams;
    double changepointPriorScale;
    double coefficientOfVariation;
    Double trainMape;
    Double validationMape;
    Double accuracy;
    AccuracyStatus accuracyStatus;
    String accuracyDetail;
    int validationDays;
    QualityReport qualityReport;
    double trainingTimeSeconds;
    Instant savedAt;
}
