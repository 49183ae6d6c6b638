package com.storeforecast.model;

import java.util.List;
import java.util.function.UnaryOperator;

/** Output of the regression engine, ordered by date. */
public record PredictionFrame(List<PredictionPoint> points) {

    public PredictionFrame {
        points = List.copyOf(points);
    }

    public int size() {
        return points.size();
    }

    public PredictionPoint get(int i) {
        return points.get(i);
    }

    public double[] yhat() {
        return points.stream().mapToDouble(PredictionPoint::yhat).toArray();
    }

    public PredictionFrame map(UnaryOperator<PredictionPoint> f) {
        return new PredictionFrame(points.stream().map(f).toList());
    }
}
