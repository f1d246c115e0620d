package com.mar.agri.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class IndicatorsTest {

    private final double[] series = {1, 2, 3, 4, 5, 6, 7, 8, 9, 10};

    @Test
    void lagShiftsAndFillsHeadWithNaN() {
        double[] lag2 = Indicators.lag(series, 2);
        assertThat(lag2[0]).isNaN();
        assertThat(lag2[1]).isNaN();
        assertThat(lag2[2]).isEqualTo(1.0);
        assertThat(lag2[9]).isEqualTo(8.0);
    }

    @Test
    void rollingMeanNarrowsAtStart() {
        double[] mean = Indicators.rollingMean(series, 7);
        assertThat(mean[0]).isEqualTo(1.0);
        assertThat(mean[1]).isEqualTo(1.5);
        assertThat(mean[6]).isEqualTo(4.0);
        // full window 4..10
        assertThat(mean[9]).isEqualTo(7.0);
    }

    @Test
    void rollingStdUsesSampleDenominator() {
        double[] std = Indicators.rollingStd(series, 7);
        assertThat(std[0]).isNaN();
        assertThat(std[1]).isCloseTo(Math.sqrt(0.5), within(1e-12));
        // 1..7 has sample variance 28/6
        assertThat(std[6]).isCloseTo(Math.sqrt(28.0 / 6.0), within(1e-12));
        assertThat(std[9]).isCloseTo(Math.sqrt(28.0 / 6.0), within(1e-12));
    }

    @Test
    void constantSeriesHasZeroStd() {
        double[] std = Indicators.rollingStd(new double[] {5, 5, 5, 5}, 7);
        assertThat(std[1]).isZero();
        assertThat(std[3]).isZero();
    }
}
