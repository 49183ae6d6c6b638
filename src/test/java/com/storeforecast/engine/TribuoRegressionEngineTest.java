package com.storeforecast.engine;

import com.storeforecast.model.DataTier;
import com.storeforecast.model.EngineParams;
import com.storeforecast.model.FeatureFrame;
import com.storeforecast.model.PredictionFrame;
import com.storeforecast.model.PredictionPoint;
import com.storeforecast.model.SeasonalityMode;
import com.storeforecast.pipeline.SeriesStats;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.storeforecast.model.FeatureColumns.*;
import static org.assertj.core.api.Assertions.*;

class TribuoRegressionEngineTest {

    private final TribuoRegressionEngine engine = new TribuoRegressionEngine();

    private FeatureFrame training;
    private EngineParams params;
    private Map<String, Double> priors;

    @BeforeEach
    void setUp() {
        List<LocalDate> dates = LocalDate.of(2024, 1, 1).datesUntil(LocalDate.of(2024, 5, 1)).toList();
        int n = dates.size();
        double[] y = new double[n];
        double[] weekend = new double[n];
        double[] promo = new double[n];
        for (int i = 0; i < n; i++) {
            boolean isWeekend = dates.get(i).getDayOfWeek().getValue() >= 6;
            weekend[i] = isWeekend ? 1 : 0;
            promo[i] = i % 10 == 0 ? 1.0 : 0.0;
            y[i] = Math.log1p(500 + (isWeekend ? 150 : 0) + 80 * promo[i]);
        }
        training = FeatureFrame.of(dates)
            .withColumn(TARGET, y)
            .withColumn(IS_WEEKEND, weekend)
            .withColumn(PROMO_INTENSITY, promo);
        params = EngineParams.builder()
            .tier(DataTier.MEDIUM)
            .weeklyFourierOrder(3)
            .seasonalityMode(SeasonalityMode.ADDITIVE)
            .seasonalityPriorScale(5.0)
            .changepointPriorScale(0.02)
            .changepointRange(0.7)
            .changepointCount(10)
            .epochs(40)
            .seed(42L)
            .build();
        priors = new LinkedHashMap<>();
        priors.put(PROMO_INTENSITY, 0.15);
        priors.put(IS_WEEKEND, 0.10);
    }

    @Test
    void fit_thenPredictOnTrainingFrame_tracksTargetLevel() {
        ForecastModel model = engine.fit(training, params, priors);

        PredictionFrame prediction = model.predict(training.select(model.regressors()));

        assertThat(model.regressors()).containsExactly(PROMO_INTENSITY, IS_WEEKEND);
        assertThat(prediction.size()).isEqualTo(training.size());
        assertThat(SeriesStats.mean(prediction.yhat()))
            .isCloseTo(SeriesStats.mean(training.column(TARGET)), within(0.3));
        for (PredictionPoint p : prediction.points()) {
            assertThat(p.yhat()).isFinite();
            assertThat(p.yhatLower()).isLessThanOrEqualTo(p.yhat());
            assertThat(p.yhatUpper()).isGreaterThanOrEqualTo(p.yhat());
        }
    }

    @Test
    void fit_isDeterministicForFixedSeed() {
        PredictionFrame first = engine.fit(training, params, priors).predict(training);
        PredictionFrame second = engine.fit(training, params, priors).predict(training);

        assertThat(second.yhat()).containsExactly(first.yhat());
    }

    @Test
    void writeThenRead_reproducesPredictions() throws IOException {
        ForecastModel model = engine.fit(training, params, priors);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        engine.write(model, out);

        ForecastModel restored = engine.read(new ByteArrayInputStream(out.toByteArray()));

        assertThat(restored.regressors()).isEqualTo(model.regressors());
        assertThat(restored.predict(training).yhat()).containsExactly(model.predict(training).yhat());
    }

    @Test
    void fit_multiplicativeSeasonality_predictsAndSurvivesRoundTrip() throws IOException {
        EngineParams multiplicative = params.toBuilder().seasonalityMode(SeasonalityMode.MULTIPLICATIVE).build();
        ForecastModel model = engine.fit(training, multiplicative, priors);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        engine.write(model, out);

        ForecastModel restored = engine.read(new ByteArrayInputStream(out.toByteArray()));

        PredictionFrame prediction = restored.predict(training);
        assertThat(prediction.yhat()).containsExactly(model.predict(training).yhat());
        assertThat(SeriesStats.mean(prediction.yhat()))
            .isCloseTo(SeriesStats.mean(training.column(TARGET)), within(0.3));
        assertThat(prediction.yhat()).isNotEqualTo(engine.fit(training, params, priors).predict(training).yhat());
    }

    @Test
    void predict_missingRegressor_throws() {
        ForecastModel model = engine.fit(training, params, priors);

        assertThatThrownBy(() -> model.predict(training.withoutColumn(PROMO_INTENSITY)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining(PROMO_INTENSITY);
    }

    @Test
    void fit_missingColumn_throws() {
        assertThatThrownBy(() -> engine.fit(training.withoutColumn(IS_WEEKEND), params, priors))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining(IS_WEEKEND);
    }

    @Test
    void read_garbage_throwsIOException() {
        assertThatThrownBy(() -> engine.read(new ByteArrayInputStream(new byte[]{1, 2, 3})))
            .isInstanceOf(IOException.class);
    }
}
