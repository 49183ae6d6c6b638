package com.storeforecast.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.storeforecast.model.QualityReport;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZonedDateTime;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ModelStatusResponse {
    String storeId;
    ModelHealth status;
    String modelVersion;
    Long modelAgeDays;
    Long dataAgeDays;
    Double accuracy;
    double accuracyThreshold;
    Integer trainingWindowDays;
    Integer dataPoints;
    LocalDate startDate;
    LocalDate endDate;
    boolean shouldRetrain;
    String reason;
    QualityReport qualityReport;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant savedAt;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    ZonedDateTime nextScheduledRetrain;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    ZonedDateTime nextScheduledEvaluation;
}
