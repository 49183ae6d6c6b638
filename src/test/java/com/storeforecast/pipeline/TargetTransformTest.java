package com.storeforecast.pipeline;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class TargetTransformTest {

    @Test
    void inverse_undoesForwardOnNonNegativeValues() {
        for (double v : new double[]{0, 1, 42.5, 12_000}) {
            assertThat(TargetTransform.inverse(TargetTransform.forward(v))).isCloseTo(v, within(1e-6));
        }
    }

    @Test
    void forward_negativeInputTreatedAsZero() {
        assertThat(TargetTransform.forward(-20)).isZero();
    }

    @Test
    void inverse_clampsExtremeModelOutput() {
        assertThat(TargetTransform.inverse(1_000)).isEqualTo(Math.expm1(20));
        assertThat(TargetTransform.inverse(-1_000)).isEqualTo(Math.expm1(-10));
        assertThat(TargetTransform.inverse(Double.NaN)).isNaN();
    }
}
