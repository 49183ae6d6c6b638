package com.storeforecast.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RetrainCheckResponse {
    String storeId;
    RetrainOutcome status;
    String reason;
    String modelVersion;
    Double accuracy;
    Integer dataPoints;
}
