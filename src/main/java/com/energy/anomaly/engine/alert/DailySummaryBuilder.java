package com.energy.anomaly.engine.alert;

import com.energy.anomaly.model.Alert;
import com.energy.anomaly.model.DailySummary;
import com.energy.anomaly.model.SeverityLevel;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Aggregates one day's alerts into a {@link DailySummary}.
 */
@Component
public class DailySummaryBuilder {

    static final String NO_ANOMALIES = "No immediate action required - no anomalies detected";
    static final String CONTACT_ON_CALL = "Contact on-call engineer for immediate investigation";
    static final String SCHEDULE_MAINTENANCE = "Schedule maintenance check within 24 hours";
    static final String INVESTIGATE_EQUIPMENT = "High deviation detected - investigate potential equipment issues";
    static final String CONTINUE_MONITORING = "Continue normal monitoring procedures";

    private static final DateTimeFormatter EXPORT_TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    static final int WARNING_ESCALATION_COUNT = 2;
    static final double HIGH_DEVIATION_PCT = 50.0;

    private final Clock clock;

    public DailySummaryBuilder(Clock clock) {
        this.clock = clock;
    }

    public DailySummary build(LocalDate date, List<Alert> alerts) {
        String exportTimestamp = EXPORT_TIMESTAMP_FORMAT.format(LocalDateTime.now(clock));

        if (alerts.isEmpty()) {
            return DailySummary.builder()
                    .exportDate(date.toString())
                    .totalAlerts(0)
                    .severityBreakdown(Collections.emptyMap())
                    .primaryTrend("N/A")
                    .status(DailySummary.STATUS_NORMAL)
                    .exportTimestamp(exportTimestamp)
                    .recommendations(List.of(NO_ANOMALIES))
                    .build();
        }

        Map<String, Long> breakdown = severityBreakdown(alerts);
        long critical = breakdown.getOrDefault(SeverityLevel.CRITICAL.getLabel(), 0L);
        long warning = breakdown.getOrDefault(SeverityLevel.WARNING.getLabel(), 0L);
        long info = breakdown.getOrDefault(SeverityLevel.INFO.getLabel(), 0L);
        double maxDeviation = alerts.stream().mapToDouble(Alert::getDeviationPercentage).max().orElse(0.0);

        return DailySummary.builder()
                .exportDate(date.toString())
                .totalAlerts(alerts.size())
                .severityBreakdown(breakdown)
                .criticalAlerts(critical)
                .warningAlerts(warning)
                .infoAlerts(info)
                .avgEnergyOutput(alerts.stream().mapToDouble(Alert::getEnergyKwh).average().orElse(0.0))
                .minEnergyOutput(alerts.stream().mapToDouble(Alert::getEnergyKwh).min().orElse(0.0))
                .maxEnergyOutput(alerts.stream().mapToDouble(Alert::getEnergyKwh).max().orElse(0.0))
                .avgDeviation(alerts.stream().mapToDouble(Alert::getDeviationPercentage).average().orElse(0.0))
                .maxDeviation(maxDeviation)
                .primaryTrend(mostCommon(alerts, Alert::getTrendDirection))
                .systemsAffected(alerts.stream().map(Alert::getUnitsAffected).distinct().count())
                .status(critical > 0 ? DailySummary.STATUS_CRITICAL : DailySummary.STATUS_NORMAL)
                .exportTimestamp(exportTimestamp)
                .recommendations(recommendations(critical, warning, maxDeviation))
                .build();
    }

    static List<String> recommendations(long criticalCount, long warningCount, double maxDeviation) {
        List<String> recommendations = new ArrayList<>();

        if (criticalCount > 0) {
            recommendations.add(String.format(
                    "Immediate attention required: %d critical anomalies detected", criticalCount));
            recommendations.add(CONTACT_ON_CALL);
        }

        if (warningCount > WARNING_ESCALATION_COUNT) {
            recommendations.add(String.format(
                    "Monitor closely: %d warning-level anomalies detected", warningCount));
            recommendations.add(SCHEDULE_MAINTENANCE);
        }

        if (maxDeviation > HIGH_DEVIATION_PCT) {
            recommendations.add(INVESTIGATE_EQUIPMENT);
        }

        if (recommendations.isEmpty()) {
            recommendations.add(CONTINUE_MONITORING);
        }
        return recommendations;
    }

    // Most frequent severity first.
    private static Map<String, Long> severityBreakdown(List<Alert> alerts) {
        Map<String, Long> counts = alerts.stream()
                .collect(Collectors.groupingBy(Alert::getSeverity, LinkedHashMap::new, Collectors.counting()));
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed())
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (a, b) -> a, LinkedHashMap::new));
    }

    // Ties resolve to the value that sorts first, like a statistical mode over strings.
    private static String mostCommon(List<Alert> alerts, Function<Alert, String> field) {
        Map<String, Long> counts = alerts.stream()
                .collect(Collectors.groupingBy(field, Collectors.counting()));
        return counts.entrySet().stream()
                .max(Comparator.<Map.Entry<String, Long>>comparingLong(Map.Entry::getValue)
                        .thenComparing(Map.Entry::getKey, Comparator.reverseOrder()))
                .map(Map.Entry::getKey)
                .orElse("N/A");
    }
}
