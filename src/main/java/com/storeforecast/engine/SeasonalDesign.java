package com.storeforecast.engine;

import com.storeforecast.model.EngineParams;
import com.storeforecast.model.SeasonalityMode;

import java.io.Serial;
import java.io.Serializable;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Trend, changepoint and Fourier inputs derived from the date, plus weighted regressor inputs.
 * Prior scales enter as input weights: a larger scale lets the same SGD step move the
 * coefficient further.
 *
 * <p>In {@link SeasonalityMode#MULTIPLICATIVE} mode every Fourier term also appears multiplied by
 * the trend input, so the linear fit of {@code (a + b*t) * s(t)} lets the seasonal amplitude
 * follow the trend level.
 */
final class SeasonalDesign implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    static final double REFERENCE_CHANGEPOINT_SCALE = 0.05;
    static final double REFERENCE_SEASONALITY_SCALE = 10.0;
    static final double REFERENCE_REGRESSOR_SCALE = 0.10;
    private static final int MAX_WEEKLY_ORDER = 3;
    private static final double YEAR_DAYS = 365.25;

    private final LocalDate origin;
    private final double spanDays;
    private final double[] changepoints;
    private final double changepointWeight;
    private final int weeklyOrder;
    private final int yearlyOrder;
    private final double seasonalityWeight;
    private final boolean multiplicative;
    private final LinkedHashMap<String, Double> regressorWeights;

    private SeasonalDesign(LocalDate origin, double spanDays, double[] changepoints, double changepointWeight,
                           int weeklyOrder, int yearlyOrder, double seasonalityWeight, boolean multiplicative,
                           LinkedHashMap<String, Double> regressorWeights) {
        this.origin = origin;
        this.spanDays = spanDays;
        this.changepoints = changepoints;
        this.changepointWeight = changepointWeight;
        this.weeklyOrder = weeklyOrder;
        this.yearlyOrder = yearlyOrder;
        this.seasonalityWeight = seasonalityWeight;
        this.multiplicative = multiplicative;
        this.regressorWeights = regressorWeights;
    }

    static SeasonalDesign fromTraining(List<LocalDate> dates, EngineParams params, Map<String, Double> priorScales) {
        LocalDate origin = dates.get(0);
        double span = Math.max(1.0, ChronoUnit.DAYS.between(origin, dates.get(dates.size() - 1)));
        int count = Math.max(0, params.getChangepointCount());
        double[] changepoints = new double[count];
        for (int k = 0; k < count; k++) {
            changepoints[k] = params.getChangepointRange() * (k + 1) / (count + 1);
        }
        LinkedHashMap<String, Double> weights = new LinkedHashMap<>();
        priorScales.forEach((name, scale) -> weights.put(name, scale / REFERENCE_REGRESSOR_SCALE));
        return new SeasonalDesign(origin, span, changepoints,
            params.getChangepointPriorScale() / REFERENCE_CHANGEPOINT_SCALE,
            Math.min(MAX_WEEKLY_ORDER, Math.max(0, params.getWeeklyFourierOrder())),
            Math.max(0, params.getYearlyFourierOrder()),
            params.getSeasonalityPriorScale() / REFERENCE_SEASONALITY_SCALE,
            params.getSeasonalityMode() == SeasonalityMode.MULTIPLICATIVE,
            weights);
    }

    boolean multiplicative() {
        return multiplicative;
    }

    List<String> regressors() {
        return List.copyOf(regressorWeights.keySet());
    }

    String[] featureNames() {
        List<String> names = new ArrayList<>();
        names.add("trend");
        for (int k = 0; k < changepoints.length; k++) {
            names.add("changepoint_" + k);
        }
        for (int k = 1; k <= weeklyOrder; k++) {
            names.add("weekly_sin_" + k);
            names.add("weekly_cos_" + k);
        }
        for (int k = 1; k <= yearlyOrder; k++) {
            names.add("yearly_sin_" + k);
            names.add("yearly_cos_" + k);
        }
        if (multiplicative) {
            int seasonal = names.size();
            for (int j = 1 + changepoints.length; j < seasonal; j++) {
                names.add(names.get(j) + "_x_trend");
            }
        }
        regressorWeights.keySet().forEach(name -> names.add("regressor_" + name));
        return names.toArray(String[]::new);
    }

    /** Values aligned with {@link #featureNames()}; {@code regressorValues} follows {@link #regressors()}. */
    double[] featureValues(LocalDate date, double[] regressorValues) {
        int seasonalTerms = 2 * weeklyOrder + 2 * yearlyOrder;
        double[] values = new double[1 + changepoints.length + seasonalTerms * (multiplicative ? 2 : 1)
            + regressorWeights.size()];
        double t = ChronoUnit.DAYS.between(origin, date) / spanDays;
        long epochDay = date.toEpochDay();
        int i = 0;
        values[i++] = t;
        for (double c : changepoints) {
            values[i++] = Math.max(0.0, t - c) * changepointWeight;
        }
        for (int k = 1; k <= weeklyOrder; k++) {
            double angle = 2 * Math.PI * k * epochDay / 7.0;
            values[i++] = Math.sin(angle) * seasonalityWeight;
            values[i++] = Math.cos(angle) * seasonalityWeight;
        }
        for (int k = 1; k <= yearlyOrder; k++) {
            double angle = 2 * Math.PI * k * epochDay / YEAR_DAYS;
            values[i++] = Math.sin(angle) * seasonalityWeight;
            values[i++] = Math.cos(angle) * seasonalityWeight;
        }
        if (multiplicative) {
            int seasonalStart = i - seasonalTerms;
            for (int j = 0; j < seasonalTerms; j++) {
                values[i++] = values[seasonalStart + j] * t;
            }
        }
        int r = 0;
        for (double weight : regressorWeights.values()) {
            double v = regressorValues[r++];
            values[i++] = (Double.isFinite(v) ? v : 0.0) * weight;
        }
        return values;
    }
}
