package com.storeforecast.config;

import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class PredictionProperties {

    @Min(1)
    private int defaultHorizonDays = 84;

    @Min(1)
    private int minHorizonDays = 1;

    @Min(1)
    private int maxHorizonDays = 365;

    @Min(0)
    private int chartHistoryDays = 60;

    @Min(1)
    private int restockProductLimit = 5;

    @Min(1)
    private int restockLookbackDays = 30;

    private double minGrowthFactor = 0.6;
    private double maxGrowthFactor = 1.9;

    /** Used when there is no positive recent history to compare against. */
    private double defaultGrowthFactor = 1.1;
    private double highUrgencyCoverage = 0.4;
    private double mediumUrgencyCoverage = 0.7;
}
