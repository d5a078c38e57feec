package com.energy.anomaly.engine.isolationforest;

import com.energy.anomaly.config.DetectionConfig;
import com.energy.anomaly.engine.FittedOutlierModel;
import com.energy.anomaly.engine.OutlierDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Random;

/**
 * Isolation Forest behind the {@link OutlierDetector} seam.
 *
 * Fitting standardizes the features, grows the forest on the scaled rows and places a
 * decision offset at the contamination percentile of the training scores. Scoring
 * returns decision values: -s(x) - offset, so lower means more anomalous and the
 * expected contamination fraction of training rows falls below zero.
 */
@Component
public class IsolationForestDetector implements OutlierDetector {

    private static final Logger log = LoggerFactory.getLogger(IsolationForestDetector.class);

    private final int numTrees;
    private final int sampleSize;

    @Autowired
    public IsolationForestDetector(DetectionConfig config) {
        this(config.getNumTrees(), config.getSampleSize());
    }

    public IsolationForestDetector(int numTrees, int sampleSize) {
        if (numTrees < 1 || sampleSize < 1) {
            throw new IllegalStateException(String.format(
                    "numTrees and sampleSize must be positive (numTrees=%d, sampleSize=%d)", numTrees, sampleSize));
        }
        this.numTrees = numTrees;
        this.sampleSize = sampleSize;
    }

    @Override
    public String getName() {
        return "isolation-forest";
    }

    @Override
    public FittedOutlierModel fit(double[][] features, double contamination, long seed) {
        requireRectangular(features);
        if (contamination <= 0.0 || contamination > 0.5) {
            throw new IllegalArgumentException("contamination must be in (0, 0.5] but was " + contamination);
        }

        FeatureScaler scaler = FeatureScaler.fit(features);
        double[][] scaled = scaler.transform(features);
        IsolationForest forest = IsolationForest.grow(scaled, numTrees, sampleSize, new Random(seed));

        double[] trainingScores = new double[scaled.length];
        for (int i = 0; i < scaled.length; i++) {
            trainingScores[i] = -forest.anomalyScore(scaled[i]);
        }
        double offset = percentile(trainingScores, contamination * 100.0);

        log.debug("Fitted isolation forest: {} trees, sampleSize={}, rows={}, features={}, offset={}",
                forest.getTreeCount(), forest.getSampleSize(), features.length, features[0].length,
                String.format("%.4f", offset));

        return new IsolationForestModel(scaler, forest, offset);
    }

    /**
     * Linear-interpolation percentile, matching numpy's default.
     */
    static double percentile(double[] values, double pct) {
        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        if (sorted.length == 1) {
            return sorted[0];
        }
        double rank = pct / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        double fraction = rank - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * fraction;
    }

    private static void requireRectangular(double[][] features) {
        if (features == null || features.length == 0) {
            throw new IllegalArgumentException("Cannot fit an outlier model on an empty feature matrix");
        }
        int cols = features[0].length;
        if (cols == 0) {
            throw new IllegalArgumentException("Feature vectors must have at least one column");
        }
        for (double[] row : features) {
            if (row.length != cols) {
                throw new IllegalArgumentException("Feature matrix rows have differing lengths");
            }
        }
    }

    /**
     * Fitted snapshot: scaler, forest and offset never change after construction.
     */
    static final class IsolationForestModel implements FittedOutlierModel {

        private final FeatureScaler scaler;
        private final IsolationForest forest;
        private final double offset;

        IsolationForestModel(FeatureScaler scaler, IsolationForest forest, double offset) {
            this.scaler = scaler;
            this.forest = forest;
            this.offset = offset;
        }

        @Override
        public double[] score(double[][] features) {
            double[][] scaled = scaler.transform(features);
            double[] decisions = new double[scaled.length];
            for (int i = 0; i < scaled.length; i++) {
                decisions[i] = -forest.anomalyScore(scaled[i]) - offset;
            }
            return decisions;
        }

        @Override
        public int getFeatureCount() {
            return scaler.getFeatureCount();
        }

        @Override
        public double[] getFeatureMeans() {
            return scaler.getMeans();
        }

        @Override
        public int getTreeCount() {
            return forest.getTreeCount();
        }

        double getOffset() {
            return offset;
        }
    }
}
