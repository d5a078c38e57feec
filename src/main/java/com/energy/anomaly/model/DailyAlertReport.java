package com.energy.anomaly.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * Formatter output for one calendar day: the alert rows plus their summary.
 */
@Value
@Builder
public class DailyAlertReport {

    LocalDate date;

    List<Alert> alerts;

    DailySummary summary;

    public int getAlertCount() {
        return alerts.size();
    }

    public boolean isEmpty() {
        return alerts.isEmpty();
    }
}
