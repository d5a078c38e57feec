package com.energy.anomaly.service;

import com.energy.anomaly.config.AlertExportConfig;
import com.energy.anomaly.engine.alert.AlertFormatter;
import com.energy.anomaly.model.DailyAlertReport;
import com.energy.anomaly.model.DailyExport;
import com.energy.anomaly.model.ExportFiles;
import com.energy.anomaly.model.ScoredReading;
import com.energy.anomaly.repository.AlertExportRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Exports one day of alerts for a series: select the day's readings, format them,
 * write the alert file and its summary.
 */
@Service
public class AlertExportService {

    private static final Logger log = LoggerFactory.getLogger(AlertExportService.class);

    private static final DateTimeFormatter FILE_DATE_FORMAT = DateTimeFormatter.BASIC_ISO_DATE;

    private final AlertFormatter alertFormatter;
    private final AlertExportRepository exportRepository;
    private final AlertExportConfig config;
    private final Clock clock;

    public AlertExportService(AlertFormatter alertFormatter,
                              AlertExportRepository exportRepository,
                              AlertExportConfig config,
                              Clock clock) {
        this.alertFormatter = alertFormatter;
        this.exportRepository = exportRepository;
        this.config = config;
        this.clock = clock;
    }

    /**
     * @param seriesId series the readings belong to; names the output sub-directory
     * @param scored   scored readings of any time span
     * @param date     day to export; today when null
     * @throws IOException when the files cannot be written
     */
    public DailyExport exportDay(String seriesId, List<ScoredReading> scored, LocalDate date) throws IOException {
        LocalDate target = date != null ? date : LocalDate.now(clock);
        log.info("Starting export for series {} date {}", seriesId, target);

        DailyAlertReport report = alertFormatter.formatDay(scored, target);
        ExportFiles files = exportRepository.save(outputDirectory(seriesId), fileStem(target), report);

        return new DailyExport(report, files);
    }

    public Path outputDirectory(String seriesId) {
        return Paths.get(config.getOutputDir()).resolve(seriesId);
    }

    public String fileStem(LocalDate date) {
        return config.getFilenamePrefix() + "_" + FILE_DATE_FORMAT.format(date);
    }
}
