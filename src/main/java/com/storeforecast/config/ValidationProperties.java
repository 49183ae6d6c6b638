package com.storeforecast.config;

import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class ValidationProperties {

    private double spikeZThreshold = 3.0;
    private double spikeClipSigma = 3.0;

    @Min(2)
    private int flatWindowDays = 7;
    private double flatVarianceFloor = 0.05;
    private double flatWindowRatio = 0.5;

    private double lowerBoundMinRatio = 0.5;
    private double lowerBoundMaxRatio = 0.95;
    private double upperBoundMinRatio = 1.0;
    private double upperBoundMaxRatio = 1.5;

    private double joinSigma = 2.0;

    @Min(1)
    private int joinFadeDays = 14;
}
