package com.mar.agri.service;

import java.util.List;
import org.springframework.stereotype.Service;
import com.mar.agri.domain.model.FeatureRow;

/**
 * Chronological train/holdout split. Rows are never shuffled: the holdout is always the most recent slice.
 */
@Service
public class DatasetSplitter {

    public record TrainTestSplit(List<FeatureRow> train,
                                 List<FeatureRow> test,
                                 int splitIdx) {}

    public TrainTestSplit split(List<FeatureRow> rows, double testFraction) {
        int n = rows.size();
        if (n < 2) {
            throw new IllegalArgumentException("need at least 2 rows to split, got " + n);
        }
        int testSize = (int) Math.ceil(n * testFraction);
        testSize = Math.max(1, Math.min(testSize, n - 1));
        int splitIdx = n - testSize;

        return new TrainTestSplit(List.copyOf(rows.subList(0, splitIdx)),
            List.copyOf(rows.subList(splitIdx, n)), splitIdx);
    }
}
