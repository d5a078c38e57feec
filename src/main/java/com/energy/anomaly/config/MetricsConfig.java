package com.energy.anomaly.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordScoredReading(String severity, double anomalyScore) {
        Counter.builder("scoring.readings.count")
                .tag("severity", severity)
                .register(registry)
                .increment();

        DistributionSummary.builder("scoring.anomaly_score")
                .register(registry)
                .record(anomalyScore);
    }

    public void recordModelFit(String seriesId) {
        Counter.builder("model.fit.count")
                .tag("series_id", seriesId)
                .register(registry)
                .increment();
    }

    public void recordDayExport(String status, int alertCount) {
        Counter.builder("export.day.count")
                .tag("status", status)
                .register(registry)
                .increment();

        Counter.builder("export.alerts.count")
                .register(registry)
                .increment(alertCount);
    }
}
