package com.storeforecast.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Date-keyed table of numeric columns. Instances are immutable: every operation returns a
 * new frame and column arrays are copied on the way in and out.
 */
public final class FeatureFrame {

    private final List<LocalDate> dates;
    private final Map<String, double[]> columns;

    private FeatureFrame(List<LocalDate> dates, Map<String, double[]> columns) {
        this.dates = dates;
        this.columns = columns;
    }

    public static FeatureFrame of(List<LocalDate> dates) {
        return new FeatureFrame(List.copyOf(dates), new LinkedHashMap<>());
    }

    public int size() {
        return dates.size();
    }

    public boolean isEmpty() {
        return dates.isEmpty();
    }

    public List<LocalDate> dates() {
        return dates;
    }

    public LocalDate date(int row) {
        return dates.get(row);
    }

    public Set<String> columnNames() {
        return Collections.unmodifiableSet(columns.keySet());
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    public double[] column(String name) {
        double[] values = columns.get(name);
        if (values == null) {
            throw new IllegalArgumentException("Unknown column '" + name + "'");
        }
        return values.clone();
    }

    public double value(String name, int row) {
        double[] values = columns.get(name);
        if (values == null) {
            throw new IllegalArgumentException("Unknown column '" + name + "'");
        }
        return values[row];
    }

    public FeatureFrame withColumn(String name, double[] values) {
        if (values.length != dates.size()) {
            throw new IllegalArgumentException("Column '" + name + "' has " + values.length
                + " values, frame has " + dates.size() + " rows");
        }
        Map<String, double[]> copy = new LinkedHashMap<>(columns);
        copy.put(name, values.clone());
        return new FeatureFrame(dates, copy);
    }

    public FeatureFrame withoutColumn(String name) {
        Map<String, double[]> copy = new LinkedHashMap<>(columns);
        copy.remove(name);
        return new FeatureFrame(dates, copy);
    }

    /** Keeps only the named columns, in the given order. Missing names are an error. */
    public FeatureFrame select(Collection<String> names) {
        Map<String, double[]> copy = new LinkedHashMap<>();
        for (String name : names) {
            double[] values = columns.get(name);
            if (values == null) {
                throw new IllegalArgumentException("Unknown column '" + name + "'");
            }
            copy.put(name, values);
        }
        return new FeatureFrame(dates, copy);
    }

    /** Rows {@code [from, to)}. */
    public FeatureFrame slice(int from, int to) {
        Map<String, double[]> copy = new LinkedHashMap<>();
        columns.forEach((name, values) -> copy.put(name, Arrays.copyOfRange(values, from, to)));
        return new FeatureFrame(List.copyOf(dates.subList(from, to)), copy);
    }

    public FeatureFrame filterRows(boolean[] keep) {
        if (keep.length != dates.size()) {
            throw new IllegalArgumentException("Row mask length " + keep.length + " != " + dates.size());
        }
        List<LocalDate> keptDates = new ArrayList<>();
        for (int i = 0; i < keep.length; i++) {
            if (keep[i]) {
                keptDates.add(dates.get(i));
            }
        }
        Map<String, double[]> copy = new LinkedHashMap<>();
        columns.forEach((name, values) -> {
            double[] kept = new double[keptDates.size()];
            int j = 0;
            for (int i = 0; i < keep.length; i++) {
                if (keep[i]) {
                    kept[j++] = values[i];
                }
            }
            copy.put(name, kept);
        });
        return new FeatureFrame(List.copyOf(keptDates), copy);
    }

    public int indexOf(LocalDate date) {
        return dates.indexOf(date);
    }

    @Override
    public String toString() {
        return "FeatureFrame{rows=" + dates.size() + ", columns=" + columns.keySet() + "}";
    }
}
