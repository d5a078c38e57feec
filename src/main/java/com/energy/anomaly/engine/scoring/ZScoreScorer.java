package com.energy.anomaly.engine.scoring;

import org.springframework.stereotype.Component;

/**
 * Standardized deviation: |value - mean| / std.
 * A zero-variance baseline yields all zeros rather than an error.
 */
@Component
public class ZScoreScorer implements StatisticalScorer {

    @Override
    public String getName() {
        return "z-score";
    }

    @Override
    public double[] score(double[] values, BaselineStats baseline) {
        double[] scores = new double[values.length];
        double std = baseline.getPopulationStd();
        if (std == 0.0) {
            return scores;
        }
        for (int i = 0; i < values.length; i++) {
            scores[i] = Math.abs(values[i] - baseline.getMean()) / std;
        }
        return scores;
    }
}
