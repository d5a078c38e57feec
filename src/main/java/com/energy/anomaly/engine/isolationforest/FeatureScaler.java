package com.energy.anomaly.engine.isolationforest;

import java.util.Arrays;

/**
 * Per-column standardization (zero mean, unit variance) with parameters frozen at fit time.
 * Constant columns keep a scale of 1 so they pass through centred but unscaled.
 */
public final class FeatureScaler {

    private final double[] means;
    private final double[] scales;

    private FeatureScaler(double[] means, double[] scales) {
        this.means = means;
        this.scales = scales;
    }

    public static FeatureScaler fit(double[][] data) {
        int rows = data.length;
        int cols = data[0].length;
        double[] means = new double[cols];
        double[] scales = new double[cols];

        for (double[] row : data) {
            for (int c = 0; c < cols; c++) {
                means[c] += row[c];
            }
        }
        for (int c = 0; c < cols; c++) {
            means[c] /= rows;
        }

        for (double[] row : data) {
            for (int c = 0; c < cols; c++) {
                double d = row[c] - means[c];
                scales[c] += d * d;
            }
        }
        for (int c = 0; c < cols; c++) {
            double std = Math.sqrt(scales[c] / rows);
            scales[c] = std > 0.0 ? std : 1.0;
        }
        return new FeatureScaler(means, scales);
    }

    public double[][] transform(double[][] data) {
        double[][] scaled = new double[data.length][];
        for (int r = 0; r < data.length; r++) {
            double[] row = data[r];
            if (row.length != means.length) {
                throw new IllegalArgumentException(String.format(
                        "Expected %d feature columns but row %d has %d", means.length, r, row.length));
            }
            double[] out = new double[row.length];
            for (int c = 0; c < row.length; c++) {
                out[c] = (row[c] - means[c]) / scales[c];
            }
            scaled[r] = out;
        }
        return scaled;
    }

    public int getFeatureCount() {
        return means.length;
    }

    public double[] getMeans() {
        return Arrays.copyOf(means, means.length);
    }

    public double[] getScales() {
        return Arrays.copyOf(scales, scales.length);
    }
}
