package com.storeforecast.pipeline;

import com.storeforecast.config.ForecastProperties;
import com.storeforecast.config.PreprocessingProperties;
import com.storeforecast.model.CalendarFlags;
import com.storeforecast.model.FeatureFrame;
import com.storeforecast.model.Observation;
import com.storeforecast.model.OutlierPolicy;
import com.storeforecast.model.SmoothingConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.storeforecast.model.FeatureColumns.*;

/**
 * Turns raw daily observations into the training feature frame.
 *
 * <p>Order of operations: outlier handling, calendar and event columns, lag features from the
 * outlier-handled target, target smoothing, log transform. Lag features are built before the
 * centered smoothing pass so that no value at or after a date reaches that date's features.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FeatureEngineer {

    private static final int LAG_DAYS = 7;
    private static final int ROLLING_DAYS = 7;
    private static final int ROLLING_MIN_PERIODS = 3;

    private final ForecastProperties properties;

    public FeatureFrame prepare(List<Observation> observations) {
        PreprocessingProperties pre = properties.getPreprocessing();
        return prepare(observations, pre.getOutlierPolicy(),
            new SmoothingConfig(pre.isSmoothingEnabled(), pre.getSmoothingWindow()));
    }

    public FeatureFrame prepare(List<Observation> observations, OutlierPolicy policy, SmoothingConfig smoothing) {
        List<Observation> rows = new ArrayList<>(observations);
        rows.sort(Comparator.comparing(Observation::date));
        rows = handleOutliers(rows, policy);

        int n = rows.size();
        List<LocalDate> dates = rows.stream().map(Observation::date).toList();
        double[] y = rows.stream().mapToDouble(Observation::target).toArray();

        FeatureFrame frame = FeatureFrame.of(dates)
            .withColumn(TRANSACTIONS_COUNT, rows.stream().mapToDouble(Observation::transactionCount).toArray())
            .withColumn(AVG_TICKET, rows.stream().mapToDouble(Observation::averageTicket).toArray())
            .withColumn(PROMO_INTENSITY, rows.stream().mapToDouble(o -> o.intensities().promo()).toArray())
            .withColumn(HOLIDAY_INTENSITY, rows.stream().mapToDouble(o -> o.intensities().holiday()).toArray())
            .withColumn(EVENT_INTENSITY, rows.stream().mapToDouble(o -> o.intensities().event()).toArray())
            .withColumn(CLOSURE_INTENSITY, rows.stream().mapToDouble(o -> o.intensities().closure()).toArray());
        frame = withCalendarFlags(frame, rows);
        frame = withLagFeatures(frame, y);

        double[] target = smoothing != null && smoothing.enabled() && smoothing.window() > 1
            ? smooth(y, smoothing.window())
            : y.clone();
        double[] model = new double[n];
        for (int i = 0; i < n; i++) {
            model[i] = properties.getTraining().isLogTransform() ? TargetTransform.forward(target[i]) : target[i];
        }
        log.debug("Features prepared | rows={} | policy={} | smoothing={}", n, policy, smoothing);
        return frame.withColumn(TARGET_ORIGINAL, target).withColumn(TARGET, model);
    }

    List<Observation> handleOutliers(List<Observation> rows, OutlierPolicy policy) {
        return OutlierHandler.apply(rows, policy, properties.getPreprocessing());
    }

    private FeatureFrame withCalendarFlags(FeatureFrame frame, List<Observation> rows) {
        int n = rows.size();
        double[][] flags = new double[FLAGS.size()][n];
        for (int i = 0; i < n; i++) {
            Observation o = rows.get(i);
            CalendarFlags f = CalendarFlags.of(o.date(), o.flags().dayBeforeHoliday(), o.flags().schoolHoliday());
            flags[0][i] = bit(f.weekend());
            flags[1][i] = bit(f.payday());
            flags[2][i] = bit(f.dayBeforeHoliday());
            flags[3][i] = bit(f.schoolHoliday());
            flags[4][i] = bit(f.monthStart());
            flags[5][i] = bit(f.monthEnd());
        }
        for (int c = 0; c < FLAGS.size(); c++) {
            frame = frame.withColumn(FLAGS.get(c), flags[c]);
        }
        return frame;
    }

    /**
     * {@code lag_7} reads the target exactly seven days earlier; the rolling statistics read the
     * seven calendar days before the row, never the row itself.
     */
    FeatureFrame withLagFeatures(FeatureFrame frame, double[] y) {
        int n = frame.size();
        Map<LocalDate, Double> byDate = new HashMap<>();
        for (int i = 0; i < n; i++) {
            byDate.put(frame.date(i), y[i]);
        }
        double[] lag = new double[n];
        double[] rollMean = new double[n];
        double[] rollStd = new double[n];
        for (int i = 0; i < n; i++) {
            LocalDate d = frame.date(i);
            Double lagged = byDate.get(d.minusDays(LAG_DAYS));
            lag[i] = lagged != null ? lagged : Double.NaN;

            List<Double> prior = new ArrayList<>(ROLLING_DAYS);
            for (int k = 1; k <= ROLLING_DAYS; k++) {
                Double v = byDate.get(d.minusDays(k));
                if (v != null) {
                    prior.add(v);
                }
            }
            if (prior.size() >= ROLLING_MIN_PERIODS) {
                double[] window = prior.stream().mapToDouble(Double::doubleValue).toArray();
                rollMean[i] = SeriesStats.mean(window);
                rollStd[i] = SeriesStats.sampleStd(window);
            } else {
                rollMean[i] = Double.NaN;
                rollStd[i] = Double.NaN;
            }
        }
        return frame
            .withColumn(LAG_7, fillWithMean(lag))
            .withColumn(ROLLING_MEAN_7, fillWithMean(rollMean))
            .withColumn(ROLLING_STD_7, fillWithMean(rollStd));
    }

    /** Centered rolling mean, rescaled so the series keeps its original mean. */
    double[] smooth(double[] y, int window) {
        int n = y.length;
        int left = window / 2;
        int right = window - 1 - left;
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            double sum = 0;
            int count = 0;
            for (int j = Math.max(0, i - left); j <= Math.min(n - 1, i + right); j++) {
                sum += y[j];
                count++;
            }
            out[i] = sum / count;
        }
        double before = SeriesStats.mean(y);
        double after = SeriesStats.mean(out);
        if (after > 0 && Double.isFinite(before)) {
            double ratio = before / after;
            for (int i = 0; i < n; i++) {
                out[i] *= ratio;
            }
        }
        return out;
    }

    private static double[] fillWithMean(double[] values) {
        double mean = SeriesStats.mean(values);
        double fill = Double.isFinite(mean) ? mean : 0.0;
        double[] out = values.clone();
        for (int i = 0; i < out.length; i++) {
            if (!Double.isFinite(out[i])) {
                out[i] = fill;
            }
        }
        return out;
    }

    private static double bit(boolean b) {
        return b ? 1.0 : 0.0;
    }
}
