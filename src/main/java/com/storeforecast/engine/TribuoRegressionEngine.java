package com.storeforecast.engine;

import com.storeforecast.model.EngineParams;
import com.storeforecast.model.FeatureFrame;
import com.storeforecast.pipeline.SeriesStats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.tribuo.Model;
import org.tribuo.MutableDataset;
import org.tribuo.provenance.SimpleDataSourceProvenance;
import org.tribuo.impl.ArrayExample;
import org.tribuo.math.optimisers.AdaGrad;
import org.tribuo.regression.RegressionFactory;
import org.tribuo.regression.Regressor;
import org.tribuo.regression.sgd.linear.LinearSGDTrainer;
import org.tribuo.regression.sgd.objectives.SquaredLoss;

import java.io.IOException;
import java.io.InputStream;
import java.io.InvalidObjectException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.storeforecast.model.FeatureColumns.TARGET;

/**
 * {@link RegressionEngine} backed by Tribuo's linear SGD regression.
 */
@Slf4j
@Component
public class TribuoRegressionEngine implements RegressionEngine {

    private static final double LEARNING_RATE = 0.1;
    private static final double EPSILON = 0.1;

    @Override
    public ForecastModel fit(FeatureFrame training, EngineParams params, Map<String, Double> regressorPriorScales) {
        if (training.size() < 2) {
            throw new IllegalArgumentException("At least two training rows are required, got " + training.size());
        }
        List<String> missing = new ArrayList<>();
        if (!training.hasColumn(TARGET)) {
            missing.add(TARGET);
        }
        regressorPriorScales.keySet().stream().filter(r -> !training.hasColumn(r)).forEach(missing::add);
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("Training frame is missing columns " + missing);
        }

        double[] y = training.column(TARGET);
        double mean = SeriesStats.mean(y);
        double std = SeriesStats.populationStd(y);
        if (!(std > 0)) {
            std = 1.0;
        }

        SeasonalDesign design = SeasonalDesign.fromTraining(training.dates(), params, regressorPriorScales);
        List<String> regressors = design.regressors();
        double[][] columns = new double[regressors.size()][];
        for (int r = 0; r < regressors.size(); r++) {
            columns[r] = training.column(regressors.get(r));
        }
        String[] names = design.featureNames();

        RegressionFactory factory = new RegressionFactory();
        MutableDataset<Regressor> dataset = new MutableDataset<>(
            new SimpleDataSourceProvenance("store-forecast-training", factory), factory);
        for (int i = 0; i < training.size(); i++) {
            double[] values = design.featureValues(training.date(i), row(columns, i));
            dataset.add(new ArrayExample<>(new Regressor(TARGET, (y[i] - mean) / std), names, values));
        }

        LinearSGDTrainer trainer = new LinearSGDTrainer(
            new SquaredLoss(), new AdaGrad(LEARNING_RATE, EPSILON), params.getEpochs(), params.getSeed());
        Model<Regressor> model = trainer.train(dataset);

        TribuoForecastModel partial = new TribuoForecastModel(model, design, mean, std, 0.0);
        double[] residuals = new double[training.size()];
        for (int i = 0; i < training.size(); i++) {
            double fitted = partial.predictStandardized(names, training.date(i), row(columns, i)) * std + mean;
            residuals[i] = y[i] - fitted;
        }
        double residualStd = SeriesStats.populationStd(residuals);
        log.info("Engine fitted | rows={} | features={} | regressors={} | seasonality={} | residual_std={}",
            training.size(), names.length, regressors.size(), design.multiplicative() ? "multiplicative" : "additive",
            String.format("%.4f", residualStd));
        return new TribuoForecastModel(model, design, mean, std, residualStd);
    }

    @Override
    public void write(ForecastModel model, OutputStream out) throws IOException {
        if (!(model instanceof TribuoForecastModel)) {
            throw new IllegalArgumentException("Unsupported model type " + model.getClass().getName());
        }
        ObjectOutputStream oos = new ObjectOutputStream(out);
        oos.writeObject(model);
        oos.flush();
    }

    @Override
    public ForecastModel read(InputStream in) throws IOException {
        ObjectInputStream ois = new ObjectInputStream(in);
        try {
            Object obj = ois.readObject();
            if (obj instanceof TribuoForecastModel model) {
                return model;
            }
            throw new InvalidObjectException("Unexpected artifact type " + (obj == null ? "null" : obj.getClass().getName()));
        } catch (ClassNotFoundException e) {
            throw new IOException("Artifact references an unknown class", e);
        }
    }

    private static double[] row(double[][] columns, int i) {
        double[] values = new double[columns.length];
        for (int c = 0; c < columns.length; c++) {
            values[c] = columns[c][i];
        }
        return values;
    }
}
