package com.econinsight.analytics.domain.service.anomaly;

import com.econinsight.analytics.domain.model.Observation;
import com.econinsight.analytics.domain.model.Series;

import java.util.List;

/**
 * Builds the per-observation feature matrix: level, month-over-month change and deviation from the
 * trailing rolling mean. Each column is z-scored so no feature dominates the random splits.
 */
public final class AnomalyFeatureExtractor {

    public static final int FEATURE_COUNT = 3;

    private final int rollingWindow;

    public AnomalyFeatureExtractor(int rollingWindow) {
        if (rollingWindow < 1) {
            throw new IllegalArgumentException("rolling window must be at least 1, got " + rollingWindow);
        }
        this.rollingWindow = rollingWindow;
    }

    public double[][] extract(Series series) {
        List<Observation> observations = series.getObservations();
        long[] offsets = series.monthOffsets();
        int n = observations.size();
        double[][] features = new double[n][FEATURE_COUNT];

        for (int i = 0; i < n; i++) {
            double value = observations.get(i).value();
            features[i][0] = value;

            // change per elapsed month, so a gap does not read as a jump
            if (i > 0) {
                long months = offsets[i] - offsets[i - 1];
                features[i][1] = (value - observations.get(i - 1).value()) / months;
            }

            if (i > 0) {
                int from = Math.max(0, i - rollingWindow);
                double sum = 0.0;
                for (int j = from; j < i; j++) sum += observations.get(j).value();
                features[i][2] = value - sum / (i - from);
            }
        }

        standardise(features);
        return features;
    }

    static void standardise(double[][] features) {
        int n = features.length;
        if (n == 0) return;
        for (int col = 0; col < features[0].length; col++) {
            double mean = 0.0;
            for (double[] row : features) mean += row[col];
            mean /= n;
            double variance = 0.0;
            for (double[] row : features) variance += (row[col] - mean) * (row[col] - mean);
            double std = Math.sqrt(variance / n);
            for (double[] row : features) {
                row[col] = std > 0 ? (row[col] - mean) / std : 0.0;
            }
        }
    }
}
