package com.storeforecast.pipeline;

import lombok.experimental.UtilityClass;

import java.util.Arrays;

/** Descriptive statistics over finite values; non-finite entries are ignored. */
@UtilityClass
public class SeriesStats {

    public double mean(double[] values) {
        double sum = 0;
        int n = 0;
        for (double v : values) {
            if (Double.isFinite(v)) {
                sum += v;
                n++;
            }
        }
        return n == 0 ? Double.NaN : sum / n;
    }

    /** Standard deviation with Bessel's correction; 0 for fewer than two values. */
    public double sampleStd(double[] values) {
        return std(values, 1);
    }

    public double populationStd(double[] values) {
        return std(values, 0);
    }

    public double median(double[] values) {
        return percentile(values, 50.0);
    }

    /** Linear interpolation between closest ranks. */
    public double percentile(double[] values, double percentile) {
        double[] sorted = Arrays.stream(values).filter(Double::isFinite).sorted().toArray();
        if (sorted.length == 0) {
            return Double.NaN;
        }
        double pos = percentile / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(pos);
        int upper = (int) Math.ceil(pos);
        if (lower == upper) {
            return sorted[lower];
        }
        return sorted[lower] + (sorted[upper] - sorted[lower]) * (pos - lower);
    }

    /**
     * Mean absolute percentage error over days with a positive actual value. Predictions are
     * floored at zero. Returns 100 when no actual value is positive.
     */
    public double mape(double[] actual, double[] predicted) {
        if (actual.length != predicted.length) {
            throw new IllegalArgumentException("MAPE inputs differ in length: " + actual.length + " vs " + predicted.length);
        }
        double sum = 0;
        int n = 0;
        for (int i = 0; i < actual.length; i++) {
            if (actual[i] > 0 && Double.isFinite(predicted[i])) {
                sum += Math.abs(actual[i] - Math.max(0.0, predicted[i])) / actual[i];
                n++;
            }
        }
        return n == 0 ? 100.0 : sum / n * 100.0;
    }

    public double round(double value, int decimals) {
        double factor = Math.pow(10, decimals);
        return Math.round(value * factor) / factor;
    }

    public double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    private double std(double[] values, int ddof) {
        double m = mean(values);
        double ss = 0;
        int n = 0;
        for (double v : values) {
            if (Double.isFinite(v)) {
                ss += (v - m) * (v - m);
                n++;
            }
        }
        return n - ddof <= 0 ? 0.0 : Math.sqrt(ss / (n - ddof));
    }
}
