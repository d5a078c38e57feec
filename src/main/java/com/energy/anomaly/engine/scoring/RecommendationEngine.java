package com.energy.anomaly.engine.scoring;

import com.energy.anomaly.config.DetectionConfig;
import com.energy.anomaly.model.SeverityLevel;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Rule table from (severity, value relative to the batch mean) to an operator action.
 */
@Component
public class RecommendationEngine {

    public static final String INSPECT_EQUIPMENT = "Immediate equipment inspection required";
    public static final String CHECK_EXTERNAL_FACTORS = "Check for external factors affecting output";
    public static final String MONITOR_AND_SCHEDULE = "Monitor closely and schedule maintenance check";
    public static final String NOTE_PATTERN = "Note for pattern analysis";
    public static final String NO_ACTION = "No action required";

    private final double lowOutputRatio;

    @Autowired
    public RecommendationEngine(DetectionConfig config) {
        this(config.getLowOutputRatio());
    }

    public RecommendationEngine(double lowOutputRatio) {
        this.lowOutputRatio = lowOutputRatio;
    }

    public String recommend(SeverityLevel severity, double value, double batchMean) {
        return switch (severity) {
            case CRITICAL -> value < batchMean * lowOutputRatio ? INSPECT_EQUIPMENT : CHECK_EXTERNAL_FACTORS;
            case WARNING -> MONITOR_AND_SCHEDULE;
            case INFO -> NOTE_PATTERN;
            case NORMAL -> NO_ACTION;
        };
    }
}
