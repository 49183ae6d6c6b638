package com.storeforecast.engine;

import com.storeforecast.model.FeatureFrame;
import com.storeforecast.model.PredictionFrame;
import com.storeforecast.model.PredictionPoint;
import org.tribuo.Model;
import org.tribuo.Prediction;
import org.tribuo.impl.ArrayExample;
import org.tribuo.regression.RegressionFactory;
import org.tribuo.regression.Regressor;

import java.io.Serial;
import java.io.Serializable;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Tribuo linear model over the seasonal design, trained on a standardized target.
 */
final class TribuoForecastModel implements ForecastModel, Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    /** Two-sided 80% normal interval. */
    static final double INTERVAL_Z = 1.2816;

    private final Model<Regressor> model;
    private final SeasonalDesign design;
    private final double targetMean;
    private final double targetStd;
    private final double residualStd;

    TribuoForecastModel(Model<Regressor> model, SeasonalDesign design,
                        double targetMean, double targetStd, double residualStd) {
        this.model = model;
        this.design = design;
        this.targetMean = targetMean;
        this.targetStd = targetStd;
        this.residualStd = residualStd;
    }

    @Override
    public List<String> regressors() {
        return design.regressors();
    }

    @Override
    public PredictionFrame predict(FeatureFrame frame) {
        List<String> regressors = design.regressors();
        List<String> missing = regressors.stream().filter(r -> !frame.hasColumn(r)).toList();
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("Prediction frame is missing regressors " + missing);
        }
        double[][] columns = new double[regressors.size()][];
        for (int r = 0; r < regressors.size(); r++) {
            columns[r] = frame.column(regressors.get(r));
        }
        String[] names = design.featureNames();
        double band = INTERVAL_Z * residualStd;
        List<PredictionPoint> points = new ArrayList<>(frame.size());
        for (int i = 0; i < frame.size(); i++) {
            LocalDate date = frame.date(i);
            double yhat = predictStandardized(names, date, row(columns, i)) * targetStd + targetMean;
            points.add(new PredictionPoint(date, yhat, yhat - band, yhat + band));
        }
        return new PredictionFrame(points);
    }

    double predictStandardized(String[] names, LocalDate date, double[] regressorValues) {
        ArrayExample<Regressor> example = new ArrayExample<>(
            RegressionFactory.UNKNOWN_REGRESSOR, names, design.featureValues(date, regressorValues));
        Prediction<Regressor> prediction = model.predict(example);
        return prediction.getOutput().getValues()[0];
    }

    double residualStd() {
        return residualStd;
    }

    private static double[] row(double[][] columns, int i) {
        double[] values = new double[columns.length];
        for (int c = 0; c < columns.length; c++) {
            values[c] = columns[c][i];
        }
        return values;
    }
}
