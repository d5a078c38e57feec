package com.energy.anomaly.service;

import com.energy.anomaly.config.AlertExportConfig;
import com.energy.anomaly.model.BatchResult;
import com.energy.anomaly.model.ScoredReading;
import com.energy.anomaly.repository.ScoredReadingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;

/**
 * Daily job that refreshes the rolling export window for every series with a scored batch.
 * Only flagged readings become alert rows. The files feed downstream integrations that
 * pick up one CSV per day.
 */
@Service
public class AlertExportScheduler {

    private static final Logger log = LoggerFactory.getLogger(AlertExportScheduler.class);

    private final ScoredReadingRepository scoredReadingRepository;
    private final BatchExportService batchExportService;
    private final AlertExportConfig config;

    public AlertExportScheduler(ScoredReadingRepository scoredReadingRepository,
                                BatchExportService batchExportService,
                                AlertExportConfig config) {
        this.scoredReadingRepository = scoredReadingRepository;
        this.batchExportService = batchExportService;
        this.config = config;
    }

    @Scheduled(cron = "${alerts.export.schedule.cron:0 5 0 * * *}")
    public void exportAllSeries() {
        if (!config.getSchedule().isEnabled()) {
            return;
        }

        Set<String> seriesIds = scoredReadingRepository.findSeriesIds();
        int failedDays = 0;
        for (String seriesId : seriesIds) {
            List<ScoredReading> anomalies = scoredReadingRepository.findLatest(seriesId).stream()
                    .filter(ScoredReading::isAnomalyFlag)
                    .toList();
            List<BatchResult> results = batchExportService.exportRecentDays(seriesId, anomalies);
            failedDays += (int) results.stream().filter(r -> !r.isSuccess()).count();
        }

        log.info("Scheduled export complete: series={}, failedDays={}", seriesIds.size(), failedDays);
    }
}
