package com.storeforecast.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class TrainingProperties {

    @Min(1)
    private int windowDays = 180;

    @Min(7)
    private int minTrainingDays = 30;

    @Min(1)
    private int validationDays = 14;

    @Min(1)
    private int maxModelAgeDays = 7;

    @Min(1)
    private int keepModelHistory = 5;

    @DecimalMin("0.0") @DecimalMax("100.0")
    private double minAccuracyThreshold = 82.0;

    @Min(0)
    private int maxDataStalenessDays = 3;

    @DecimalMin("0.0") @DecimalMax("1.0")
    private double minNonZeroRatio = 0.7;

    @DecimalMin("0.0") @DecimalMax("1.0")
    private double maxOutlierRatio = 0.05;

    @DecimalMin("0.0")
    private double outlierZThreshold = 3.5;

    private boolean logTransform = true;

    /** Epochs for the SGD regression engine. */
    @Min(1)
    private int engineEpochs = 150;

    private long engineSeed = 42L;
}
