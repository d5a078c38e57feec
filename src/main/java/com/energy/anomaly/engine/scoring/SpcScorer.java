package com.energy.anomaly.engine.scoring;

import com.energy.anomaly.config.DetectionConfig;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Statistical process control with 3-sigma limits.
 *
 *   ucl = mean + 3σ, lcl = mean - 3σ
 *   score = max(0, value - ucl) / σ + max(0, lcl - value) / σ
 *
 * Values inside the limits score 0. A zero σ is replaced by epsilon, so any value off a
 * perfectly flat baseline scores very high and values on it score 0.
 */
@Component
public class SpcScorer implements StatisticalScorer {

    public static final double SIGMA_LIMIT = 3.0;

    private final double epsilon;

    @Autowired
    public SpcScorer(DetectionConfig config) {
        this(config.getEpsilon());
    }

    public SpcScorer(double epsilon) {
        this.epsilon = epsilon;
    }

    @Override
    public String getName() {
        return "spc";
    }

    @Override
    public double[] score(double[] values, BaselineStats baseline) {
        double sigma = baseline.getSampleStd() > 0.0 ? baseline.getSampleStd() : epsilon;
        double ucl = baseline.getMean() + SIGMA_LIMIT * baseline.getSampleStd();
        double lcl = baseline.getMean() - SIGMA_LIMIT * baseline.getSampleStd();

        double[] scores = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            double upper = Math.max(0.0, values[i] - ucl) / sigma;
            double lower = Math.max(0.0, lcl - values[i]) / sigma;
            scores[i] = upper + lower;
        }
        return scores;
    }
}
