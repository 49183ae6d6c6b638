package com.storeforecast.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class QualityReport {
    int totalDays;
    double nonZeroRatio;
    int outlierCount;
    double outlierRatio;
    long dataAgeDays;
}
