package com.mar.agri.service;

import org.junit.jupiter.api.Test;
import com.mar.agri.config.AppProperties;
import com.mar.agri.domain.model.ConfidenceInterval;
import com.mar.agri.domain.model.ModelMetrics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ForecastEvaluatorTest {

    private final ForecastEvaluator evaluator = new ForecastEvaluator(new AppProperties());

    @Test
    void computesMaeR2AndAccuracy() {
        ModelMetrics m = evaluator.evaluate(new double[] {100, 110, 120}, new double[] {102, 108, 120});

        assertThat(m.mae()).isCloseTo(4.0 / 3.0, within(1e-12));
        // ssRes = 8, ssTot = 200
        assertThat(m.r2Score()).isCloseTo(1.0 - 8.0 / 200.0, within(1e-12));
        assertThat(m.accuracy()).isCloseTo((1.0 - (4.0 / 3.0) / 110.0) * 100.0, within(1e-9));
    }

    @Test
    void constantHoldoutScoresOneOnlyWhenExact() {
        assertThat(evaluator.evaluate(new double[] {50, 50}, new double[] {50, 50}).r2Score()).isEqualTo(1.0);
        assertThat(evaluator.evaluate(new double[] {50, 50}, new double[] {51, 50}).r2Score()).isEqualTo(0.0);
    }

    @Test
    void accuracyIsClampedToZero() {
        ModelMetrics m = evaluator.evaluate(new double[] {10, 10}, new double[] {40, 40});
        assertThat(m.accuracy()).isZero();
        assertThat(m.r2Score()).isZero();
    }

    @Test
    void zeroMeanHoldoutReportsZeroAccuracy() {
        ModelMetrics m = evaluator.evaluate(new double[] {-1, 1}, new double[] {-1, 1});
        assertThat(m.accuracy()).isZero();
        assertThat(m.mae()).isZero();
        assertThat(m.r2Score()).isEqualTo(1.0);
    }

    @Test
    void intervalIsOneAndAHalfMaeAndFlooredAtZero() {
        ConfidenceInterval ci = evaluator.interval(100, 10);
        assertThat(ci.lower()).isEqualTo(85.0);
        assertThat(ci.upper()).isEqualTo(115.0);

        ConfidenceInterval floored = evaluator.interval(5, 10);
        assertThat(floored.lower()).isZero();
        assertThat(floored.upper()).isEqualTo(20.0);
    }

    @Test
    void rejectsMismatchedArrays() {
        assertThatThrownBy(() -> evaluator.evaluate(new double[] {1}, new double[] {1, 2}))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
