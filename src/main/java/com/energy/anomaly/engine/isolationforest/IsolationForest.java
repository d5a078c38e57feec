package com.energy.anomaly.engine.isolationforest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * An immutable ensemble of isolation trees.
 */
public final class IsolationForest {

    private final List<IsolationTree> trees;
    private final int sampleSize;

    private IsolationForest(List<IsolationTree> trees, int sampleSize) {
        this.trees = Collections.unmodifiableList(trees);
        this.sampleSize = sampleSize;
    }

    /**
     * Grow a forest on the given data.
     *
     * @param data       training rows (already scaled)
     * @param numTrees   number of trees (typically 100)
     * @param sampleSize sub-sample size per tree (typically 256), capped at data.length
     * @param random     source of randomness, seeded by the caller
     */
    public static IsolationForest grow(double[][] data, int numTrees, int sampleSize, Random random) {
        if (data.length == 0) {
            throw new IllegalArgumentException("Cannot grow an isolation forest on an empty matrix");
        }
        if (numTrees < 1) {
            throw new IllegalArgumentException("numTrees must be positive but was " + numTrees);
        }
        int effectiveSampleSize = Math.max(1, Math.min(sampleSize, data.length));
        int maxDepth = (int) Math.ceil(Math.log(Math.max(2, effectiveSampleSize)) / Math.log(2));

        List<IsolationTree> trees = new ArrayList<>(numTrees);
        for (int i = 0; i < numTrees; i++) {
            trees.add(IsolationTree.grow(subsample(data, effectiveSampleSize, random), maxDepth, random));
        }
        return new IsolationForest(trees, effectiveSampleSize);
    }

    /**
     * Anomaly score s(x, n) = 2^(-E(h(x)) / c(n)).
     *
     * @return value in (0, 1]; close to 1 is anomalous, well below 0.5 is normal
     */
    public double anomalyScore(double[] point) {
        double c = IsolationNode.averagePathLength(sampleSize);
        if (c <= 0) {
            // Single-sample forest: every point is equally (un)remarkable.
            return 0.5;
        }
        double avgPathLength = 0.0;
        for (IsolationTree tree : trees) {
            avgPathLength += tree.pathLength(point);
        }
        avgPathLength /= trees.size();
        return Math.pow(2.0, -avgPathLength / c);
    }

    public int getTreeCount() {
        return trees.size();
    }

    public int getSampleSize() {
        return sampleSize;
    }

    // Partial Fisher-Yates: sampling without replacement.
    private static double[][] subsample(double[][] data, int size, Random random) {
        int[] indices = new int[data.length];
        for (int i = 0; i < data.length; i++) indices[i] = i;
        double[][] sample = new double[size][];
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(data.length - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
            sample[i] = data[indices[i]];
        }
        return sample;
    }
}
