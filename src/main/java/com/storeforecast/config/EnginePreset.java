package com.storeforecast.config;

import com.storeforecast.model.SeasonalityMode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Regression engine preset for one data-volume tier. A Fourier order of 0 disables
 * the seasonality.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EnginePreset {
    private int yearlyFourierOrder;
    private int weeklyFourierOrder;
    private SeasonalityMode seasonalityMode = SeasonalityMode.ADDITIVE;
    private double seasonalityPriorScale;
    private double changepointPriorScale;
    private double changepointRange;
    private int changepointCount;
}
