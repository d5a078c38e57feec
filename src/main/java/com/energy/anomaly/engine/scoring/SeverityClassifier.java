package com.energy.anomaly.engine.scoring;

import com.energy.anomaly.config.DetectionConfig;
import com.energy.anomaly.model.SeverityLevel;
import org.springframework.stereotype.Component;

/**
 * Maps a combined score to a severity level using the configured thresholds.
 */
@Component
public class SeverityClassifier {

    private final DetectionConfig.Thresholds thresholds;

    public SeverityClassifier(DetectionConfig config) {
        config.validate();
        this.thresholds = config.getThresholds();
    }

    public SeverityLevel classify(double combinedScore) {
        return SeverityLevel.fromScore(combinedScore,
                thresholds.getInfo(), thresholds.getWarning(), thresholds.getCritical());
    }

    // Strictly above the info threshold.
    public boolean isAnomalous(double combinedScore) {
        return combinedScore > thresholds.getInfo();
    }
}
