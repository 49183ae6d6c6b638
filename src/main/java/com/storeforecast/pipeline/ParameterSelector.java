package com.storeforecast.pipeline;

import com.storeforecast.config.EnginePreset;
import com.storeforecast.config.ForecastProperties;
import com.storeforecast.config.ParameterProperties;
import com.storeforecast.model.DataTier;
import com.storeforecast.model.EngineParams;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Chooses engine hyperparameters from the window length and the target's volatility.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ParameterSelector {

    static final double DEFAULT_CV = 0.5;

    private final ForecastProperties properties;

    public EngineParams select(int dataLength, double coefficientOfVariation) {
        ParameterProperties p = properties.getParameters();
        DataTier tier = tierFor(dataLength);
        EnginePreset preset = switch (tier) {
            case SHORT -> p.getShortPreset();
            case MEDIUM -> p.getMediumPreset();
            case LONG -> p.getLongPreset();
        };

        double changepointScale = preset.getChangepointPriorScale();
        if (coefficientOfVariation < p.getLowVolatilityCv()) {
            changepointScale *= p.getLowVolatilityFactor();
        } else if (coefficientOfVariation > p.getHighVolatilityCv()) {
            changepointScale *= p.getHighVolatilityFactor();
        }
        changepointScale = SeriesStats.clamp(changepointScale,
            p.getMinChangepointPriorScale(), p.getMaxChangepointPriorScale());

        log.info("Parameters selected | days={} | tier={} | cv={} | changepoint_prior_scale={}",
            dataLength, tier, String.format("%.3f", coefficientOfVariation), String.format("%.4f", changepointScale));

        return EngineParams.builder()
            .tier(tier)
            .yearlyFourierOrder(preset.getYearlyFourierOrder())
            .weeklyFourierOrder(preset.getWeeklyFourierOrder())
            .seasonalityMode(preset.getSeasonalityMode())
            .seasonalityPriorScale(preset.getSeasonalityPriorScale())
            .changepointPriorScale(changepointScale)
            .changepointRange(preset.getChangepointRange())
            .changepointCount(preset.getChangepointCount())
            .coefficientOfVariation(coefficientOfVariation)
            .epochs(properties.getTraining().getEngineEpochs())
            .seed(properties.getTraining().getEngineSeed())
            .build();
    }

    public DataTier tierFor(int dataLength) {
        ParameterProperties p = properties.getParameters();
        if (dataLength < p.getShortThresholdDays()) {
            return DataTier.SHORT;
        }
        return dataLength <= p.getMediumThresholdDays() ? DataTier.MEDIUM : DataTier.LONG;
    }

    /** {@code std / mean} of the target, or 0.5 when the mean is not positive. */
    public static double coefficientOfVariation(double[] target) {
        double mean = SeriesStats.mean(target);
        if (!(mean > 0)) {
            return DEFAULT_CV;
        }
        return SeriesStats.sampleStd(target) / mean;
    }
}
