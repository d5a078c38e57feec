package com.energy.anomaly.engine.scoring;

/**
 * Mean and spread of the batch the statistical scorers measure against.
 * Z-scores use the population std, control limits use the sample std.
 */
public final class BaselineStats {

    private final int count;
    private final double mean;
    private final double populationStd;
    private final double sampleStd;

    private BaselineStats(int count, double mean, double populationStd, double sampleStd) {
        this.count = count;
        this.mean = mean;
        this.populationStd = populationStd;
        this.sampleStd = sampleStd;
    }

    public static BaselineStats of(double[] values) {
        if (values.length == 0) {
            throw new IllegalArgumentException("Baseline requires at least one value");
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        double mean = sum / values.length;

        double sq = 0.0;
        for (double v : values) {
            double d = v - mean;
            sq += d * d;
        }
        double populationStd = Math.sqrt(sq / values.length);
        double sampleStd = values.length > 1 ? Math.sqrt(sq / (values.length - 1)) : 0.0;
        return new BaselineStats(values.length, mean, populationStd, sampleStd);
    }

    public int getCount() {
        return count;
    }

    public double getMean() {
        return mean;
    }

    public double getPopulationStd() {
        return populationStd;
    }

    public double getSampleStd() {
        return sampleStd;
    }

    @Override
    public String toString() {
        return String.format("BaselineStats[n=%d, mean=%.3f, popStd=%.3f, sampleStd=%.3f]",
                count, mean, populationStd, sampleStd);
    }
}
