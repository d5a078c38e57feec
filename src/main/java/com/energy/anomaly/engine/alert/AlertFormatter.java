package com.energy.anomaly.engine.alert;

import com.energy.anomaly.config.AlertExportConfig;
import com.energy.anomaly.engine.features.ReadingTimestamps;
import com.energy.anomaly.model.Alert;
import com.energy.anomaly.model.DailyAlertReport;
import com.energy.anomaly.model.ScoredReading;
import com.energy.anomaly.model.SeverityLevel;
import com.energy.anomaly.model.TrendDirection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Derives export-ready alert rows for one calendar day.
 *
 * All derived fields use the day's own readings as the baseline:
 *   expected_min         = max(0, dayMean - 2 * dayStd)
 *   expected_max         = dayMean + 2 * dayStd
 *   deviation_percentage = round(|value - dayMean| / dayMean * 100, 2)
 *   trend_direction      = Declining if values never increase, Variable otherwise,
 *                          Single Point for a one-alert day
 */
@Component
public class AlertFormatter {

    private static final Logger log = LoggerFactory.getLogger(AlertFormatter.class);

    public static final String UNMAPPED_STATUS = "Under Review";
    public static final String DEFAULT_ACTION = "Review and investigate";

    private final AlertExportConfig config;
    private final DailySummaryBuilder summaryBuilder;
    private final Clock clock;

    public AlertFormatter(AlertExportConfig config, DailySummaryBuilder summaryBuilder, Clock clock) {
        this.config = config;
        this.summaryBuilder = summaryBuilder;
        this.clock = clock;
    }

    /**
     * Select the readings of one day from a scored batch and format them.
     *
     * @param scored all scored readings, in chronological order
     * @param date   target day; today when null
     */
    public DailyAlertReport formatDay(List<ScoredReading> scored, LocalDate date) {
        LocalDate target = date != null ? date : LocalDate.now(clock);
        return format(readingsForDay(scored, target), target);
    }

    public List<ScoredReading> readingsForDay(List<ScoredReading> scored, LocalDate date) {
        List<ScoredReading> day = new ArrayList<>();
        int unparseable = 0;
        for (ScoredReading reading : scored) {
            Optional<LocalDateTime> ts = ReadingTimestamps.parse(reading.getTimestamp());
            if (ts.isEmpty()) {
                unparseable++;
            } else if (ts.get().toLocalDate().equals(date)) {
                day.add(reading);
            }
        }
        if (unparseable > 0) {
            log.warn("{} of {} readings have no usable timestamp and were skipped for {}",
                    unparseable, scored.size(), date);
        }
        log.info("Filtered {} readings for date {}", day.size(), date);
        return day;
    }

    /**
     * Format one day's readings. Alert ids run 1..N in the given order.
     */
    public DailyAlertReport format(List<ScoredReading> dayReadings, LocalDate date) {
        if (dayReadings.isEmpty()) {
            return DailyAlertReport.builder()
                    .date(date)
                    .alerts(Collections.emptyList())
                    .summary(summaryBuilder.build(date, Collections.emptyList()))
                    .build();
        }

        double[] values = dayReadings.stream().mapToDouble(ScoredReading::getValue).toArray();
        double mean = mean(values);
        double std = sampleStd(values, mean);
        double expectedMin = Math.max(0.0, mean - 2.0 * std);
        double expectedMax = mean + 2.0 * std;
        TrendDirection trend = trendOf(values);
        String createdAt = ReadingTimestamps.format(LocalDateTime.now(clock));

        List<Alert> alerts = new ArrayList<>(dayReadings.size());
        for (int i = 0; i < dayReadings.size(); i++) {
            ScoredReading reading = dayReadings.get(i);
            alerts.add(Alert.builder()
                    .alertId(i + 1)
                    .timestamp(displayTimestamp(reading.getTimestamp()))
                    .energyKwh(reading.getValue())
                    .severity(reading.getSeverity() != null ? reading.getSeverity().getLabel() : "Unknown")
                    .anomalyScore(reading.getAnomalyScore())
                    .deviationPercentage(deviationPercentage(reading.getValue(), mean))
                    .expectedMin(expectedMin)
                    .expectedMax(expectedMax)
                    .systemStatus(systemStatus(reading.getSeverity()))
                    .recommendedAction(actionOrDefault(reading.getRecommendedAction()))
                    .unitsAffected(config.getUnitsAffected())
                    .trendDirection(trend.getLabel())
                    .createdAt(createdAt)
                    .build());
        }

        return DailyAlertReport.builder()
                .date(date)
                .alerts(Collections.unmodifiableList(alerts))
                .summary(summaryBuilder.build(date, alerts))
                .build();
    }

    /**
     * |value - mean| / mean * 100, rounded half-even to 2 decimals. A zero mean yields 0.
     */
    public static double deviationPercentage(double value, double mean) {
        if (mean == 0.0) {
            return 0.0;
        }
        return round2(Math.abs((value - mean) / mean * 100.0));
    }

    public static TrendDirection trendOf(double[] values) {
        if (values.length <= 1) {
            return TrendDirection.SINGLE_POINT;
        }
        for (int i = 1; i < values.length; i++) {
            if (values[i] > values[i - 1]) {
                return TrendDirection.VARIABLE;
            }
        }
        return TrendDirection.DECLINING;
    }

    public static String systemStatus(SeverityLevel severity) {
        return severity != null ? severity.getSystemStatus() : UNMAPPED_STATUS;
    }

    private static String actionOrDefault(String action) {
        return action == null || action.isBlank() ? DEFAULT_ACTION : action;
    }

    private static String displayTimestamp(String raw) {
        return ReadingTimestamps.parse(raw).map(ReadingTimestamps::format).orElse(raw);
    }

    private static double mean(double[] values) {
        double sum = 0.0;
        for (double v : values) sum += v;
        return sum / values.length;
    }

    // Sample std; a single value has no spread.
    private static double sampleStd(double[] values, double mean) {
        if (values.length < 2) {
            return 0.0;
        }
        double sq = 0.0;
        for (double v : values) {
            double d = v - mean;
            sq += d * d;
        }
        return Math.sqrt(sq / (values.length - 1));
    }

    static double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_EVEN).doubleValue();
    }
}
