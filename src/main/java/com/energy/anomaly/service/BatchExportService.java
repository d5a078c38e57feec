package com.energy.anomaly.service;

import com.energy.anomaly.config.AlertExportConfig;
import com.energy.anomaly.config.MetricsConfig;
import com.energy.anomaly.model.BatchResult;
import com.energy.anomaly.model.BatchStatus;
import com.energy.anomaly.model.DailyExport;
import com.energy.anomaly.model.ScoredReading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Exports a rolling window of days ending at a reference date, newest day first.
 * Every day is exported independently: a failed day is logged and recorded as FAILED,
 * and the remaining days still run. The result always has one entry per day.
 */
@Service
public class BatchExportService {

    private static final Logger log = LoggerFactory.getLogger(BatchExportService.class);

    private final AlertExportService alertExportService;
    private final AlertExportConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public BatchExportService(AlertExportService alertExportService,
                              AlertExportConfig config,
                              MetricsConfig metricsConfig,
                              Clock clock) {
        this.alertExportService = alertExportService;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * Export the configured number of days ending today.
     */
    public List<BatchResult> exportRecentDays(String seriesId, List<ScoredReading> scored) {
        return exportWindow(seriesId, scored, LocalDate.now(clock), config.getBatchDays());
    }

    /**
     * @param referenceDate last day of the window
     * @param days          window length, at least 1
     * @return one result per day, referenceDate first
     */
    public List<BatchResult> exportWindow(String seriesId, List<ScoredReading> scored,
                                          LocalDate referenceDate, int days) {
        if (days < 1) {
            throw new IllegalArgumentException("Batch export needs at least one day but got " + days);
        }
        log.info("=== Starting batch export for {}: {} days ending {} ===", seriesId, days, referenceDate);

        List<BatchResult> results = new ArrayList<>(days);
        for (int i = 0; i < days; i++) {
            LocalDate date = referenceDate.minusDays(i);
            try {
                DailyExport export = alertExportService.exportDay(seriesId, scored, date);
                results.add(BatchResult.success(date, export.files().alertFile().toString(), export.alertCount()));
                metricsConfig.recordDayExport(BatchStatus.SUCCESS.toJson(), export.alertCount());
            } catch (Exception e) {
                log.error("Failed to export for {} on {}: {}", seriesId, date, e.getMessage(), e);
                results.add(BatchResult.failed(date, describe(e)));
                metricsConfig.recordDayExport(BatchStatus.FAILED.toJson(), 0);
            }
        }

        long failed = results.stream().filter(r -> !r.isSuccess()).count();
        log.info("=== Batch export complete for {}: {} succeeded, {} failed ===",
                seriesId, results.size() - failed, failed);
        return results;
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
