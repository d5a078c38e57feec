package com.energy.anomaly.engine.isolationforest;

import java.util.Random;

/**
 * A single isolation tree grown on a sub-sample with random axis-aligned splits.
 */
final class IsolationTree {

    private final IsolationNode root;

    private IsolationTree(IsolationNode root) {
        this.root = root;
    }

    static IsolationTree grow(double[][] sample, int maxDepth, Random random) {
        return new IsolationTree(growNode(sample, 0, maxDepth, random));
    }

    double pathLength(double[] point) {
        return root.pathLength(point);
    }

    private static IsolationNode growNode(double[][] rows, int depth, int maxDepth, Random random) {
        int n = rows.length;
        if (depth >= maxDepth || n <= 1) {
            return IsolationNode.leaf(n);
        }

        // Visit features in random order and split on the first one that is not constant here.
        int numFeatures = rows[0].length;
        int[] order = shuffledIndices(numFeatures, random);
        for (int featureIdx : order) {
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (double[] row : rows) {
                min = Math.min(min, row[featureIdx]);
                max = Math.max(max, row[featureIdx]);
            }
            if (min >= max) {
                continue;
            }

            double splitValue = min + random.nextDouble() * (max - min);
            int leftCount = 0;
            for (double[] row : rows) {
                if (row[featureIdx] < splitValue) leftCount++;
            }
            if (leftCount == 0 || leftCount == n) {
                // Rounding put the split on an edge value; treat the feature as unsplittable.
                continue;
            }

            double[][] leftRows = new double[leftCount][];
            double[][] rightRows = new double[n - leftCount][];
            int li = 0;
            int ri = 0;
            for (double[] row : rows) {
                if (row[featureIdx] < splitValue) {
                    leftRows[li++] = row;
                } else {
                    rightRows[ri++] = row;
                }
            }

            return IsolationNode.split(featureIdx, splitValue,
                    growNode(leftRows, depth + 1, maxDepth, random),
                    growNode(rightRows, depth + 1, maxDepth, random));
        }

        // Every feature is constant: these points cannot be isolated further.
        return IsolationNode.leaf(n);
    }

    private static int[] shuffledIndices(int count, Random random) {
        int[] indices = new int[count];
        for (int i = 0; i < count; i++) indices[i] = i;
        for (int i = count - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
        }
        return indices;
    }
}
