package com.storeforecast.pipeline;

import com.storeforecast.exception.ScalerException;
import com.storeforecast.model.FeatureFrame;
import com.storeforecast.model.ScalerParams;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collection;

/**
 * Per-column standardization. {@link #fit} only ever sees the training slice;
 * {@link #transform} only ever uses persisted parameters.
 */
@Slf4j
@Component
public class Scaler {

    public ScalerParams fit(FeatureFrame training, Collection<String> columns) {
        ScalerParams.ScalerParamsBuilder builder = ScalerParams.builder();
        for (String column : columns) {
            if (!training.hasColumn(column)) {
                log.debug("Scaler fit skipped absent column | column={}", column);
                continue;
            }
            double[] values = training.column(column);
            double mean = SeriesStats.mean(values);
            double scale = SeriesStats.populationStd(values);
            if (!Double.isFinite(mean)) {
                mean = 0.0;
                scale = 0.0;
            }
            builder.column(column).mean(column, mean).scale(column, scale);
        }
        return builder.build();
    }

    public FeatureFrame transform(FeatureFrame frame, ScalerParams params) {
        requireComplete(params);
        FeatureFrame out = frame;
        for (String column : params.getColumns()) {
            double mean = params.getMeans().get(column);
            double scale = params.getScales().get(column);
            double[] values;
            if (frame.hasColumn(column)) {
                values = frame.column(column);
            } else {
                log.warn("Scaler input missing column, filled with training mean | column={} | mean={}", column, mean);
                values = new double[frame.size()];
                Arrays.fill(values, mean);
            }
            if (scale == 0.0) {
                log.warn("Scaler column is constant, mapped to 0.0 | column={}", column);
                out = out.withColumn(column, new double[frame.size()]);
                continue;
            }
            int replaced = 0;
            double[] scaled = new double[values.length];
            for (int i = 0; i < values.length; i++) {
                double z = (values[i] - mean) / scale;
                if (Double.isFinite(z)) {
                    scaled[i] = z;
                } else {
                    scaled[i] = 0.0;
                    replaced++;
                }
            }
            if (replaced > 0) {
                log.warn("Non-finite scaled values replaced with 0.0 | column={} | count={}", column, replaced);
            }
            out = out.withColumn(column, scaled);
        }
        return out;
    }

    public void requireComplete(ScalerParams params) {
        if (params == null || params.getColumns() == null) {
            throw new ScalerException("Scaler parameters are missing");
        }
        for (String column : params.getColumns()) {
            Double mean = params.getMeans() != null ? params.getMeans().get(column) : null;
            Double scale = params.getScales() != null ? params.getScales().get(column) : null;
            if (mean == null || scale == null) {
                throw new ScalerException("Scaler parameters incomplete for column '" + column + "'");
            }
            if (!Double.isFinite(mean)) {
                throw new ScalerException("Invalid mean " + mean + " for column '" + column + "'");
            }
            if (!Double.isFinite(scale) || scale < 0) {
                throw new ScalerException("Invalid scale " + scale + " for column '" + column + "'");
            }
        }
    }
}
