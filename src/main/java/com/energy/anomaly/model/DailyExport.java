package com.energy.anomaly.model;

/**
 * A persisted day: what was formatted and where it was written.
 */
public record DailyExport(DailyAlertReport report, ExportFiles files) {

    public int alertCount() {
        return report.getAlertCount();
    }
}
