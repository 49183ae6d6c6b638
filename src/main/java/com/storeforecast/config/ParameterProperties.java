package com.storeforecast.config;

import com.storeforecast.model.SeasonalityMode;
import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class ParameterProperties {

    /** Windows shorter than this use the short preset. */
    @Min(1)
    private int shortThresholdDays = 90;

    /** Windows longer than this use the long preset. */
    @Min(1)
    private int mediumThresholdDays = 180;

    private double lowVolatilityCv = 0.25;
    private double highVolatilityCv = 0.5;
    private double lowVolatilityFactor = 0.8;
    private double highVolatilityFactor = 1.2;
    private double minChangepointPriorScale = 0.01;
    private double maxChangepointPriorScale = 0.15;

    private EnginePreset shortPreset =
        new EnginePreset(0, 5, SeasonalityMode.MULTIPLICATIVE, 5.0, 0.03, 0.7, 10);
    private EnginePreset mediumPreset =
        new EnginePreset(0, 5, SeasonalityMode.ADDITIVE, 5.0, 0.02, 0.7, 10);
    private EnginePreset longPreset =
        new EnginePreset(8, 10, SeasonalityMode.MULTIPLICATIVE, 10.0, 0.08, 0.85, 25);
}
