package com.storeforecast.support;

import com.storeforecast.engine.ForecastModel;
import com.storeforecast.engine.RegressionEngine;
import com.storeforecast.model.EngineParams;
import com.storeforecast.model.FeatureFrame;
import com.storeforecast.model.PredictionFrame;
import com.storeforecast.model.PredictionPoint;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Predicts a constant and serializes only a tag, so artifacts can be told apart. */
public class StubRegressionEngine implements RegressionEngine {

    @Override
    public ForecastModel fit(FeatureFrame training, EngineParams params, Map<String, Double> regressorPriorScales) {
        return new StubModel("fit", List.copyOf(regressorPriorScales.keySet()), 6.0);
    }

    @Override
    public void write(ForecastModel model, OutputStream out) throws IOException {
        StubModel stub = (StubModel) model;
        DataOutputStream data = new DataOutputStream(out);
        data.writeUTF(stub.tag());
        data.writeInt(stub.regressors().size());
        for (String r : stub.regressors()) {
            data.writeUTF(r);
        }
        data.writeDouble(stub.value());
        data.flush();
    }

    @Override
    public ForecastModel read(InputStream in) throws IOException {
        DataInputStream data = new DataInputStream(in);
        String tag = data.readUTF();
        int n = data.readInt();
        List<String> regressors = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            regressors.add(data.readUTF());
        }
        return new StubModel(tag, regressors, data.readDouble());
    }

    public record StubModel(String tag, List<String> regressors, double value) implements ForecastModel {
        @Override
        public PredictionFrame predict(FeatureFrame frame) {
            List<PredictionPoint> points = new ArrayList<>();
            for (int i = 0; i < frame.size(); i++) {
                points.add(new PredictionPoint(frame.date(i), value, value - 0.1, value + 0.1));
            }
            return new PredictionFrame(points);
        }
    }
}
