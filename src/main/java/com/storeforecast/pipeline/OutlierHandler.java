package com.storeforecast.pipeline;

import com.storeforecast.config.PreprocessingProperties;
import com.storeforecast.model.Observation;
import com.storeforecast.model.OutlierPolicy;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies an {@link OutlierPolicy} to the target of date-ordered observations. Training
 * features and synthesized lag features both read the target through this rule.
 */
@Slf4j
@UtilityClass
public class OutlierHandler {

    public List<Observation> apply(List<Observation> rows, OutlierPolicy policy, PreprocessingProperties pre) {
        if (rows.isEmpty() || policy == null || policy == OutlierPolicy.NONE) {
            return rows;
        }
        double[] y = rows.stream().mapToDouble(Observation::target).toArray();
        List<Observation> result = new ArrayList<>(rows.size());
        int adjusted = 0;
        if (policy == OutlierPolicy.CLIP) {
            double lower = SeriesStats.percentile(y, pre.getClipLowerPercentile());
            double upper = SeriesStats.percentile(y, pre.getClipUpperPercentile());
            for (Observation o : rows) {
                double clipped = SeriesStats.clamp(o.target(), lower, upper);
                if (clipped != o.target()) {
                    adjusted++;
                    result.add(o.withTarget(clipped));
                } else {
                    result.add(o);
                }
            }
        } else {
            double mean = SeriesStats.mean(y);
            double std = SeriesStats.sampleStd(y);
            for (Observation o : rows) {
                if (std > 0 && Math.abs(o.target() - mean) / std > pre.getRemoveZThreshold()) {
                    adjusted++;
                } else {
                    result.add(o);
                }
            }
        }
        if (adjusted > 0) {
            log.info("Outliers handled | policy={} | rows={}", policy, adjusted);
        }
        return result;
    }
}
