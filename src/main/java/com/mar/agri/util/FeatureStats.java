package com.mar.agri.util;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import java.util.List;
import java.util.stream.DoubleStream;
import com.mar.agri.domain.model.FeatureRow;

@Slf4j
@UtilityClass
public class FeatureStats {

    public double mean(double[] values) {
        return DoubleStream.of(values).average().orElse(Double.NaN);
    }

    /** Population standard deviation. */
    public double std(double[] values) {
        double mean = mean(values);
        double variance = DoubleStream.of(values).map(v -> (v - mean) * (v - mean)).average().orElse(Double.NaN);
        return Math.sqrt(variance);
    }

    /** Sample standard deviation, 0 for fewer than two values. */
    public double sampleStd(double[] values) {
        if (values.length < 2) return 0.0;
        double mean = mean(values);
        double ss = DoubleStream.of(values).map(v -> (v - mean) * (v - mean)).sum();
        return Math.sqrt(ss / (values.length - 1));
    }

    public void logFeatureStats(List<FeatureRow> rows) {
        if (rows == null || rows.isEmpty()) {
            log.warn("No feature rows to compute stats for.");
            return;
        }
        if (!log.isDebugEnabled()) return;

        List<String> names = FeatureRow.FEATURE_NAMES;
        for (int f = 0; f < names.size(); f++) {
            final int idx = f;
            double[] vals = rows.stream().mapToDouble(r -> r.features()[idx]).toArray();
            log.debug("FEATURE {} | min={} max={} mean={} std={}", names.get(f),
                String.format("%.4f", DoubleStream.of(vals).min().orElse(Double.NaN)),
                String.format("%.4f", DoubleStream.of(vals).max().orElse(Double.NaN)),
                String.format("%.4f", mean(vals)),
                String.format("%.4f", std(vals)));
        }
    }
}
