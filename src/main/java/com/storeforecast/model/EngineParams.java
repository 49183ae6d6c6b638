package com.storeforecast.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class EngineParams {
    DataTier tier;
    int yearlyFourierOrder;
    int weeklyFourierOrder;
    SeasonalityMode seasonalityMode;
    double seasonalityPriorScale;
    double changepointPriorScale;
    double changepointRange;
    int changepointCount;
    double coefficientOfVariation;
    int epochs;
    long seed;
}
