package com.storeforecast.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

/**
 * Weekly rolling-origin evaluation: fold cutoffs start after {@code initialDays}, move back
 * from the end by {@code periodDays}, and each fold scores the next {@code horizonDays}.
 */
@Data
public class EvaluationProperties {

    private boolean enabled = true;

    /** Mondays at this time in the configured zone. */
    @Pattern(regexp = "^([01]\\d|2[0-3]):[0-5]\\d$")
    private String time = "03:00";

    @Min(7)
    private int initialDays = 180;

    @Min(1)
    private int periodDays = 30;

    @Min(1)
    private int horizonDays = 14;

    /** Mean fold MAPE (percent) above which the store is retrained. */
    @DecimalMin("0.0")
    private double mapeThreshold = 18.0;
}
