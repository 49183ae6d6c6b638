package com.storeforecast.pipeline;

import com.storeforecast.config.ForecastProperties;
import com.storeforecast.config.ValidationProperties;
import com.storeforecast.model.Observation;
import com.storeforecast.model.PredictionFrame;
import com.storeforecast.model.PredictionPoint;
import com.storeforecast.model.ValidationOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Checks engine output on the original scale against recent history and corrects it in place.
 * Corrections are applied in order: invalid values, the join with history, spikes, interval bounds.
 * Flatness is only reported.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ForecastValidator {

    private final ForecastProperties properties;

    public ValidationOutcome validateAndCorrect(PredictionFrame prediction, List<Observation> history) {
        ValidationProperties v = properties.getValidation();
        List<Observation> sorted = history.stream().sorted(Comparator.comparing(Observation::date)).toList();
        double[] actual = sorted.stream().mapToDouble(Observation::target).toArray();
        double mean = SeriesStats.mean(actual);
        double std = SeriesStats.sampleStd(actual);
        Map<DayOfWeek, Double> weekdayAverage = weekdayAverages(sorted, mean);

        List<String> warnings = new ArrayList<>();
        List<PredictionPoint> points = new ArrayList<>(prediction.points());

        for (int i = 0; i < points.size(); i++) {
            PredictionPoint p = points.get(i);
            if (!Double.isFinite(p.yhat()) || p.yhat() <= 0) {
                double replacement = weekdayAverage.getOrDefault(p.date().getDayOfWeek(), 0.0);
                warnings.add("Invalid prediction " + p.yhat() + " on " + p.date()
                    + " replaced with weekday average " + round(replacement));
                points.set(i, p.withValues(replacement, finiteOr(p.yhatLower(), replacement), finiteOr(p.yhatUpper(), replacement)));
            }
        }

        if (actual.length > 0) {
            fadeJoin(points, actual[actual.length - 1], std, warnings);
        }
        clipSpikes(points, mean, std, warnings);

        int boundsAdjusted = 0;
        for (int i = 0; i < points.size(); i++) {
            PredictionPoint p = points.get(i);
            double yhat = Math.max(0.0, p.yhat());
            double lower = clampBound(p.yhatLower(), yhat * v.getLowerBoundMinRatio(), yhat * v.getLowerBoundMaxRatio());
            double upper = clampBound(p.yhatUpper(), yhat * v.getUpperBoundMinRatio(), yhat * v.getUpperBoundMaxRatio());
            if (lower != p.yhatLower() || upper != p.yhatUpper() || yhat != p.yhat()) {
                boundsAdjusted++;
                points.set(i, p.withValues(yhat, Math.max(0.0, lower), Math.max(0.0, upper)));
            }
        }
        if (boundsAdjusted > 0) {
            log.debug("Prediction intervals adjusted | rows={}", boundsAdjusted);
        }

        PredictionFrame corrected = new PredictionFrame(points);
        String flat = flatnessWarning(corrected.yhat());
        if (flat != null) {
            log.warn("Forecast looks flat | {}", flat);
            warnings.add(flat);
        }
        return new ValidationOutcome(warnings.isEmpty(), warnings, corrected);
    }

    /**
     * Share of rolling windows whose variance over mean squared is below the floor. A flat
     * forecast usually means the regressors reached the engine empty.
     */
    String flatnessWarning(double[] yhat) {
        ValidationProperties v = properties.getValidation();
        int window = v.getFlatWindowDays();
        int windows = yhat.length - window + 1;
        if (windows <= 0) {
            return null;
        }
        int flat = 0;
        for (int start = 0; start < windows; start++) {
            double[] slice = Arrays.copyOfRange(yhat, start, start + window);
            double m = SeriesStats.mean(slice);
            double variance = Math.pow(SeriesStats.populationStd(slice), 2);
            double normalized = m != 0 ? variance / (m * m) : 0.0;
            if (normalized < v.getFlatVarianceFloor()) {
                flat++;
            }
        }
        if (flat > windows * v.getFlatWindowRatio()) {
            return "Forecast is nearly flat in " + flat + " of " + windows
                + " rolling windows; regressors may be empty, consider retraining";
        }
        return null;
    }

    /**
     * Scales the first days of the horizon so the forecast starts at the last actual value, with
     * the adjustment fading out linearly.
     */
    private void fadeJoin(List<PredictionPoint> points, double last, double std, List<String> warnings) {
        ValidationProperties v = properties.getValidation();
        if (points.isEmpty() || !(std > 0)) {
            return;
        }
        double first = points.get(0).yhat();
        if (last <= 0 || first <= 0 || Math.abs(first - last) <= v.getJoinSigma() * std) {
            return;
        }
        double ratio = last / first;
        int fade = Math.min(v.getJoinFadeDays(), points.size());
        for (int i = 0; i < fade; i++) {
            double weight = 1.0 - (double) i / v.getJoinFadeDays();
            double factor = 1.0 + (ratio - 1.0) * weight;
            PredictionPoint p = points.get(i);
            points.set(i, p.withValues(p.yhat() * factor, p.yhatLower() * factor, p.yhatUpper() * factor));
        }
        warnings.add("Forecast start " + round(first) + " deviated from last actual " + round(last)
            + " by more than " + v.getJoinSigma() + " sigma, faded over " + fade + " days");
    }

    /** Runs after every step that rescales values, so no corrected value leaves mean ± clip sigma. */
    private void clipSpikes(List<PredictionPoint> points, double mean, double std, List<String> warnings) {
        ValidationProperties v = properties.getValidation();
        if (!(std > 0)) {
            return;
        }
        for (int i = 0; i < points.size(); i++) {
            PredictionPoint p = points.get(i);
            double z = (p.yhat() - mean) / std;
            if (Math.abs(z) > v.getSpikeZThreshold()) {
                double clipped = Math.max(0.0, mean + Math.signum(z) * v.getSpikeClipSigma() * std);
                log.warn("Forecast spike clipped | date={} | value={} | z={} | clipped={}",
                    p.date(), round(p.yhat()), round(z), round(clipped));
                warnings.add("Spike on " + p.date() + ": " + round(p.yhat()) + " (z=" + round(z)
                    + ") clipped to " + round(clipped));
                double ratio = p.yhat() != 0 ? clipped / p.yhat() : 1.0;
                points.set(i, p.withValues(clipped, p.yhatLower() * ratio, p.yhatUpper() * ratio));
            }
        }
    }

    private static Map<DayOfWeek, Double> weekdayAverages(List<Observation> history, double fallback) {
        Map<DayOfWeek, Double> averages = new EnumMap<>(DayOfWeek.class);
        for (DayOfWeek dow : DayOfWeek.values()) {
            double[] values = history.stream()
                .filter(o -> o.date().getDayOfWeek() == dow && o.target() > 0)
                .mapToDouble(Observation::target)
                .toArray();
            double avg = SeriesStats.mean(values);
            averages.put(dow, Double.isFinite(avg) ? avg : (Double.isFinite(fallback) ? fallback : 0.0));
        }
        return averages;
    }

    private static double clampBound(double value, double min, double max) {
        if (!Double.isFinite(value)) {
            return min;
        }
        return Math.max(min, Math.min(max, value));
    }

    private static double finiteOr(double value, double fallback) {
        return Double.isFinite(value) ? value : fallback;
    }

    private static double round(double value) {
        return SeriesStats.round(value, 2);
    }
}
