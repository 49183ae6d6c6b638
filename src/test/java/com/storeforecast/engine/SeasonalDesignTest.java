package com.storeforecast.engine;

import com.storeforecast.model.EngineParams;
import com.storeforecast.model.SeasonalityMode;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class SeasonalDesignTest {

    private static final List<LocalDate> DATES = LocalDate.of(2024, 1, 1).datesUntil(LocalDate.of(2024, 4, 10)).toList();

    private static EngineParams params(SeasonalityMode mode) {
        return EngineParams.builder()
            .weeklyFourierOrder(2)
            .yearlyFourierOrder(1)
            .seasonalityMode(mode)
            .seasonalityPriorScale(10.0)
            .changepointPriorScale(0.05)
            .changepointRange(0.8)
            .changepointCount(1)
            .build();
    }

    @Test
    void featureNames_additive_hasNoTrendInteractions() {
        SeasonalDesign design = SeasonalDesign.fromTraining(DATES, params(SeasonalityMode.ADDITIVE), Map.of("promo", 0.1));

        assertThat(design.multiplicative()).isFalse();
        assertThat(design.featureNames()).containsExactly("trend", "changepoint_0",
            "weekly_sin_1", "weekly_cos_1", "weekly_sin_2", "weekly_cos_2", "yearly_sin_1", "yearly_cos_1",
            "regressor_promo");
    }

    @Test
    void featureValues_multiplicative_scalesEachSeasonalTermByTrend() {
        SeasonalDesign design = SeasonalDesign.fromTraining(DATES, params(SeasonalityMode.MULTIPLICATIVE), Map.of("promo", 0.1));
        String[] names = design.featureNames();
        LocalDate day = DATES.get(60);

        double[] values = design.featureValues(day, new double[]{1.0});

        assertThat(names).hasSize(15).contains("weekly_sin_1_x_trend", "yearly_cos_1_x_trend");
        assertThat(values).hasSize(names.length);
        double t = values[0];
        assertThat(t).isGreaterThan(0.0);
        for (int j = 2; j < 8; j++) {
            assertThat(names[j + 6]).isEqualTo(names[j] + "_x_trend");
            assertThat(values[j + 6]).isCloseTo(values[j] * t, within(1e-12));
        }
        assertThat(names[14]).isEqualTo("regressor_promo");
        assertThat(values[14]).isCloseTo(1.0, within(1e-12));
    }
}
