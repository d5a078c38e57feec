package com.energy.anomaly.engine.scoring;

import com.energy.anomaly.config.DetectionConfig;
import com.energy.anomaly.model.ScoreSet;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Normalizes the three raw signals to [0, 1] and fuses them with fixed weights.
 *
 *   isolation: min-max over the batch, inverted so higher = more anomalous
 *   z:         clip(z / zCap, 0, 1)
 *   spc:       clip(spc / spcCap, 0, 1)
 *   combined = wIso * isolation + wZ * z + wSpc * spc
 *
 * Weights sum to 1, so the combined score is a convex combination and stays in [0, 1].
 */
@Component
public class ScoreCombiner {

    private final DetectionConfig.Weights weights;
    private final double zCap;
    private final double spcCap;
    private final double epsilon;

    public ScoreCombiner(DetectionConfig config) {
        config.validate();
        this.weights = config.getWeights();
        this.zCap = config.getZscoreCap();
        this.spcCap = config.getSpcCap();
        this.epsilon = config.getEpsilon();
    }

    public List<ScoreSet> combine(double[] isolationScores, double[] zScores, double[] spcScores) {
        int n = isolationScores.length;
        if (zScores.length != n || spcScores.length != n) {
            throw new IllegalArgumentException(String.format(
                    "Score arrays differ in length (isolation=%d, z=%d, spc=%d)", n, zScores.length, spcScores.length));
        }

        double[] isolationNormalized = normalizeIsolation(isolationScores);

        List<ScoreSet> result = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            double iso = isolationNormalized[i];
            double z = clip(zScores[i] / zCap);
            double spc = clip(spcScores[i] / spcCap);
            double combined = weights.getIsolation() * iso + weights.getZ() * z + weights.getSpc() * spc;

            result.add(ScoreSet.builder()
                    .isolationScore(isolationScores[i])
                    .zScore(zScores[i])
                    .spcScore(spcScores[i])
                    .isolationNormalized(iso)
                    .zNormalized(z)
                    .spcNormalized(spc)
                    .combined(combined)
                    .build());
        }
        return result;
    }

    /**
     * Min-max rescale over the batch, then invert. A zero range maps every point to 1.
     */
    public double[] normalizeIsolation(double[] isolationScores) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double s : isolationScores) {
            min = Math.min(min, s);
            max = Math.max(max, s);
        }
        double range = max - min + epsilon;

        double[] normalized = new double[isolationScores.length];
        for (int i = 0; i < isolationScores.length; i++) {
            normalized[i] = clip(1.0 - (isolationScores[i] - min) / range);
        }
        return normalized;
    }

    private static double clip(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(1.0, value));
    }
}
