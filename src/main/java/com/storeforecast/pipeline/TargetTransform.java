package com.storeforecast.pipeline;

import lombok.experimental.UtilityClass;

/**
 * {@code log1p} on the way into the engine and a clipped {@code expm1} on the way out.
 */
@UtilityClass
public class TargetTransform {

    public final double MIN_LOG = -10.0;
    public final double MAX_LOG = 20.0;

    public double forward(double value) {
        return Math.log1p(Math.max(0.0, value));
    }

    public double inverse(double value) {
        if (Double.isNaN(value)) {
            return Double.NaN;
        }
        return Math.expm1(Math.max(MIN_LOG, Math.min(MAX_LOG, value)));
    }
}
