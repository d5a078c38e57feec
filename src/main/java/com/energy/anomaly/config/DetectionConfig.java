package com.energy.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "detection")
public class DetectionConfig {

    // Expected fraction of anomalous readings, used to place the outlier model's decision offset.
    private double contamination = 0.1;

    // Seed for tree sub-sampling and split selection. Same seed + same data = same model.
    private long randomSeed = 42L;

    private int numTrees = 100;

    // Sub-sample size per tree, capped at the number of training readings.
    private int sampleSize = 256;

    // Adds rolling mean/std over a trailing window when the readings form a sequence.
    private boolean sequentialFeatures = true;

    // Normalization caps: z/4 and spc/3 are clipped to [0, 1].
    private double zscoreCap = 4.0;
    private double spcCap = 3.0;

    // Guards every division by a batch range or standard deviation.
    private double epsilon = 1e-8;

    // Critical readings below this fraction of the batch mean point at the equipment itself.
    private double lowOutputRatio = 0.5;

    private Weights weights = new Weights();

    private Thresholds thresholds = new Thresholds();

    @Data
    public static class Weights {
        private double isolation = 0.5;
        private double z = 0.3;
        private double spc = 0.2;

        public double sum() {
            return isolation + z + spc;
        }
    }

    @Data
    public static class Thresholds {
        private double info = 0.3;
        private double warning = 0.5;
        private double critical = 0.8;
    }

    /**
     * Fails fast on settings that would make the fused score meaningless.
     */
    public void validate() {
        if (Math.abs(weights.sum() - 1.0) > 1e-9) {
            throw new IllegalStateException("detection.weights must sum to 1.0 but sum to " + weights.sum());
        }
        if (!(thresholds.info < thresholds.warning && thresholds.warning < thresholds.critical)) {
            throw new IllegalStateException(String.format(
                    "detection.thresholds must be ascending (info=%.2f, warning=%.2f, critical=%.2f)",
                    thresholds.info, thresholds.warning, thresholds.critical));
        }
        if (contamination <= 0.0 || contamination > 0.5) {
            throw new IllegalStateException("detection.contamination must be in (0, 0.5] but was " + contamination);
        }
    }
}
