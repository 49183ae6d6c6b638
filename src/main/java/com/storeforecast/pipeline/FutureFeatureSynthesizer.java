package com.storeforecast.pipeline;

import com.storeforecast.config.ForecastProperties;
import com.storeforecast.config.SynthesisProperties;
import com.storeforecast.model.CalendarFlags;
import com.storeforecast.model.EventCalendar;
import com.storeforecast.model.EventCategory;
import com.storeforecast.model.EventIntensities;
import com.storeforecast.model.FeatureFrame;
import com.storeforecast.model.Observation;
import com.storeforecast.model.OutlierPolicy;
import com.storeforecast.model.SynthesisMode;
import com.storeforecast.model.SynthesisReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.ToDoubleFunction;

import static com.storeforecast.model.FeatureColumns.*;

/**
 * Builds regressor frames for dates whose actual values are unknown: forecast horizons and
 * the holdout window used to measure validation error.
 *
 * <p>Only observations dated strictly before the first target date are read, in both modes.
 * Forecast mode additionally ignores anything dated after today.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FutureFeatureSynthesizer {

    private static final int LAG_DAYS = 7;
    private static final int ROLLING_DAYS = 7;
    private static final int ROLLING_MIN_PERIODS = 3;

    private final ForecastProperties properties;
    private final Clock clock;

    public FeatureFrame synthesize(List<LocalDate> targetDates, List<Observation> history,
                                   EventCalendar calendar, SynthesisMode mode) {
        return synthesize(targetDates, history, calendar, mode, properties.getPreprocessing().getOutlierPolicy());
    }

    /**
     * Lag and rolling columns read the target after {@code lagPolicy} is applied to the usable
     * history, matching the outlier handling the model was trained with.
     */
    public FeatureFrame synthesize(List<LocalDate> targetDates, List<Observation> history,
                                   EventCalendar calendar, SynthesisMode mode, OutlierPolicy lagPolicy) {
        List<LocalDate> dates = targetDates.stream().sorted().toList();
        if (dates.isEmpty()) {
            return FeatureFrame.of(dates);
        }
        List<Observation> known = usableHistory(history, dates.get(0), mode);
        int n = dates.size();

        double[][] flags = new double[FLAGS.size()][n];
        double[][] intensities = new double[INTENSITIES.size()][n];
        for (int i = 0; i < n; i++) {
            LocalDate d = dates.get(i);
            boolean dayBeforeHoliday = calendar.hasCategory(d.plusDays(1), EventCategory.HOLIDAY);
            CalendarFlags f = CalendarFlags.of(d, dayBeforeHoliday, false);
            flags[0][i] = bit(f.weekend());
            flags[1][i] = bit(f.payday());
            flags[2][i] = bit(f.dayBeforeHoliday());
            flags[3][i] = bit(f.schoolHoliday());
            flags[4][i] = bit(f.monthStart());
            flags[5][i] = bit(f.monthEnd());

            EventIntensities e = calendar.intensitiesOn(d);
            intensities[0][i] = e.promo();
            intensities[1][i] = e.holiday();
            intensities[2][i] = e.event();
            intensities[3][i] = e.closure();
        }

        SynthesisProperties s = properties.getSynthesis();
        double[] transactions = exponentialSmoothing(
            baseline(dates, known, Observation::transactionCount, s.getDefaultTransactions(), true), s.getSmoothingAlpha());
        double[] tickets = exponentialSmoothing(
            baseline(dates, known, Observation::averageTicket, s.getDefaultAvgTicket(), false), s.getSmoothingAlpha());
        for (int i = 0; i < n; i++) {
            double promo = intensities[0][i];
            double holiday = intensities[1][i];
            double event = intensities[2][i];
            double closure = intensities[3][i];
            transactions[i] *= (1 + s.getPromoTransactionUplift() * promo)
                * (1 + s.getHolidayTransactionUplift() * holiday)
                * (1 + s.getEventTransactionUplift() * event)
                * Math.max(0.0, 1 - closure);
            tickets[i] *= Math.max(0.0, 1 - s.getPromoTicketDiscount() * promo);
        }

        FeatureFrame frame = FeatureFrame.of(dates)
            .withColumn(TRANSACTIONS_COUNT, clip(transactions, s.getMinTransactions(), s.getMaxTransactions(), s.getDefaultTransactions()))
            .withColumn(AVG_TICKET, clip(tickets, s.getMinAvgTicket(), s.getMaxAvgTicket(), s.getDefaultAvgTicket()));
        for (int c = 0; c < INTENSITIES.size(); c++) {
            frame = frame.withColumn(INTENSITIES.get(c), clip(intensities[c], 0.0, s.getMaxIntensity(), 0.0));
        }
        for (int c = 0; c < FLAGS.size(); c++) {
            frame = frame.withColumn(FLAGS.get(c), flags[c]);
        }
        frame = withLagFeatures(frame, OutlierHandler.apply(known, lagPolicy, properties.getPreprocessing()));
        log.debug("Features synthesized | mode={} | dates={} | history_days={}", mode, n, known.size());
        return frame;
    }

    /**
     * Checks the frame before it reaches the engine: dates unique and consecutive, every value finite.
     */
    public SynthesisReport validate(FeatureFrame frame) {
        List<String> errors = new ArrayList<>();
        if (frame.isEmpty()) {
            errors.add("frame has no rows");
            return SynthesisReport.of(errors);
        }
        Set<LocalDate> seen = new HashSet<>();
        for (int i = 0; i < frame.size(); i++) {
            LocalDate d = frame.date(i);
            if (!seen.add(d)) {
                errors.add("duplicate date " + d);
            }
            if (i > 0) {
                long gap = ChronoUnit.DAYS.between(frame.date(i - 1), d);
                if (gap > 1) {
                    errors.add("missing dates between " + frame.date(i - 1) + " and " + d);
                } else if (gap < 1 && !d.equals(frame.date(i - 1))) {
                    errors.add("dates out of order at " + d);
                }
            }
        }
        for (String column : frame.columnNames()) {
            double[] values = frame.column(column);
            for (int i = 0; i < values.length; i++) {
                if (!Double.isFinite(values[i])) {
                    errors.add("non-finite value in " + column + " at " + frame.date(i));
                }
            }
        }
        return SynthesisReport.of(errors);
    }

    private List<Observation> usableHistory(List<Observation> history, LocalDate firstTarget, SynthesisMode mode) {
        LocalDate today = LocalDate.now(clock);
        return history.stream()
            .filter(o -> o.date().isBefore(firstTarget))
            .filter(o -> mode == SynthesisMode.VALIDATION || !o.date().isAfter(today))
            .sorted(Comparator.comparing(Observation::date))
            .toList();
    }

    /**
     * Same-weekday mean over the short window blended with the same-weekday median over the
     * long window. Without same-weekday samples the overall level is used with a weekend uplift.
     */
    private double[] baseline(List<LocalDate> dates, List<Observation> known,
                              ToDoubleFunction<Observation> field, double fallback, boolean paydayAdjusted) {
        SynthesisProperties s = properties.getSynthesis();
        double[] out = new double[dates.size()];
        if (known.isEmpty()) {
            Arrays.fill(out, fallback);
            return out;
        }
        LocalDate last = known.get(known.size() - 1).date();
        List<Observation> meanWindow = trailing(known, last, s.getMeanWindowDays());
        List<Observation> medianWindow = trailing(known, last, s.getMedianWindowDays());
        double overallMean = SeriesStats.mean(values(meanWindow, field));
        double overallMedian = SeriesStats.median(values(medianWindow, field));
        double overall = blend(overallMean, overallMedian, fallback);

        Map<DayOfWeek, Double> byWeekday = new LinkedHashMap<>();
        for (DayOfWeek dow : DayOfWeek.values()) {
            double mean = SeriesStats.mean(values(sameWeekday(meanWindow, dow), field));
            double median = SeriesStats.median(values(sameWeekday(medianWindow, dow), field));
            byWeekday.put(dow, blend(mean, median, Double.NaN));
        }

        for (int i = 0; i < dates.size(); i++) {
            LocalDate d = dates.get(i);
            double value = byWeekday.get(d.getDayOfWeek());
            if (!Double.isFinite(value)) {
                value = overall * (CalendarFlags.isWeekend(d) ? s.getWeekendMultiplier() : 1.0);
            }
            if (paydayAdjusted && CalendarFlags.of(d, false, false).payday()) {
                value *= s.getPaydayMultiplier();
            }
            out[i] = value;
        }
        return out;
    }

    private FeatureFrame withLagFeatures(FeatureFrame frame, List<Observation> known) {
        int n = frame.size();
        Map<LocalDate, Double> targets = new LinkedHashMap<>();
        known.forEach(o -> targets.put(o.date(), o.target()));
        double[] recent = known.stream()
            .skip(Math.max(0, known.size() - ROLLING_DAYS))
            .mapToDouble(Observation::target)
            .toArray();
        double recentMean = finiteOr(SeriesStats.mean(recent), 0.0);
        double recentStd = SeriesStats.sampleStd(recent);
        double[] weekdayMean = new double[7];
        List<Observation> meanWindow = known.isEmpty() ? List.of()
            : trailing(known, known.get(known.size() - 1).date(), properties.getSynthesis().getMeanWindowDays());
        for (DayOfWeek dow : DayOfWeek.values()) {
            weekdayMean[dow.getValue() - 1] = finiteOr(
                SeriesStats.mean(values(sameWeekday(meanWindow, dow), Observation::target)), recentMean);
        }

        double[] lag = new double[n];
        double[] rollMean = new double[n];
        double[] rollStd = new double[n];
        for (int i = 0; i < n; i++) {
            LocalDate d = frame.date(i);
            Double lagged = targets.get(d.minusDays(LAG_DAYS));
            lag[i] = lagged != null ? lagged : weekdayMean[d.getDayOfWeek().getValue() - 1];

            List<Double> prior = new ArrayList<>(ROLLING_DAYS);
            for (int k = 1; k <= ROLLING_DAYS; k++) {
                Double v = targets.get(d.minusDays(k));
                if (v != null) {
                    prior.add(v);
                }
            }
            if (prior.size() >= ROLLING_MIN_PERIODS) {
                double[] window = prior.stream().mapToDouble(Double::doubleValue).toArray();
                rollMean[i] = SeriesStats.mean(window);
                rollStd[i] = SeriesStats.sampleStd(window);
            } else {
                rollMean[i] = recentMean;
                rollStd[i] = recentStd;
            }
        }
        double upper = Double.MAX_VALUE;
        return frame
            .withColumn(LAG_7, clip(lag, 0.0, upper, 0.0))
            .withColumn(ROLLING_MEAN_7, clip(rollMean, 0.0, upper, 0.0))
            .withColumn(ROLLING_STD_7, clip(rollStd, 0.0, upper, 0.0));
    }

    static double[] exponentialSmoothing(double[] values, double alpha) {
        double[] out = values.clone();
        for (int i = 1; i < out.length; i++) {
            out[i] = alpha * values[i] + (1 - alpha) * out[i - 1];
        }
        return out;
    }

    private static List<Observation> trailing(List<Observation> known, LocalDate last, int days) {
        LocalDate from = last.minusDays(days - 1L);
        return known.stream().filter(o -> !o.date().isBefore(from)).toList();
    }

    private static List<Observation> sameWeekday(List<Observation> rows, DayOfWeek dow) {
        return rows.stream().filter(o -> o.date().getDayOfWeek() == dow).toList();
    }

    private static double[] values(List<Observation> rows, ToDoubleFunction<Observation> field) {
        return rows.stream().mapToDouble(field).toArray();
    }

    private static double blend(double mean, double median, double fallback) {
        boolean hasMean = Double.isFinite(mean);
        boolean hasMedian = Double.isFinite(median);
        if (hasMean && hasMedian) {
            return (mean + median) / 2.0;
        }
        if (hasMean) {
            return mean;
        }
        return hasMedian ? median : fallback;
    }

    private static double[] clip(double[] values, double min, double max, double fallback) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            double v = Double.isFinite(values[i]) ? values[i] : fallback;
            out[i] = Math.max(min, Math.min(max, v));
        }
        return out;
    }

    private static double finiteOr(double value, double fallback) {
        return Double.isFinite(value) ? value : fallback;
    }

    private static double bit(boolean b) {
        return b ? 1.0 : 0.0;
    }
}
