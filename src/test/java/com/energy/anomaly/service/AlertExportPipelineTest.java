package com.energy.anomaly.service;

import com.energy.anomaly.config.AlertExportConfig;
import com.energy.anomaly.config.MetricsConfig;
import com.energy.anomaly.engine.EnsembleAnomalyDetector;
import com.energy.anomaly.engine.EnsembleModel;
import com.energy.anomaly.engine.alert.AlertFormatter;
import com.energy.anomaly.engine.alert.DailySummaryBuilder;
import com.energy.anomaly.model.Alert;
import com.energy.anomaly.model.BatchResult;
import com.energy.anomaly.model.BatchStatus;
import com.energy.anomaly.model.DailyExport;
import com.energy.anomaly.model.Reading;
import com.energy.anomaly.model.ScoredReading;
import com.energy.anomaly.repository.AlertExportRepository;
import com.energy.anomaly.testutil.TestDataFactory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Scores a week of readings and exports them to a temporary directory with real components.
 */
class AlertExportPipelineTest {

    private static final LocalDate REFERENCE = LocalDate.of(2024, 1, 15);

    @TempDir
    Path tempDir;

    private AlertExportService alertExportService;
    private BatchExportService batchExportService;
    private List<ScoredReading> scored;

    @BeforeEach
    void setUp() {
        AlertExportConfig config = new AlertExportConfig();
        config.setOutputDir(tempDir.toString());

        AlertFormatter formatter = new AlertFormatter(config,
                new DailySummaryBuilder(TestDataFactory.FIXED_CLOCK), TestDataFactory.FIXED_CLOCK);
        alertExportService = new AlertExportService(
                formatter, new AlertExportRepository(), config, TestDataFactory.FIXED_CLOCK);
        batchExportService = new BatchExportService(alertExportService, config,
                new MetricsConfig(new SimpleMeterRegistry()), TestDataFactory.FIXED_CLOCK);

        EnsembleAnomalyDetector detector =
                TestDataFactory.ensembleDetector(TestDataFactory.detectionConfig(), TestDataFactory.FIXED_CLOCK);
        EnsembleModel model = detector.fit(
                TestDataFactory.hourlyReadings(LocalDateTime.of(2024, 1, 1, 0, 0), TestDataFactory.steadyValues(240)));

        // Readings on Jan 13 and Jan 15 only; the 15th ends in a sharp drop.
        List<Reading> batch = new ArrayList<>(
                TestDataFactory.hourlyReadings(LocalDateTime.of(2024, 1, 13, 10, 0), 500, 498, 502));
        batch.addAll(TestDataFactory.hourlyReadings(LocalDateTime.of(2024, 1, 15, 6, 0), 500, 500, 500, 150));
        scored = detector.score(model, batch);
    }

    @Test
    void exportDay_writesFilesUnderSeriesDirectory() throws IOException {
        DailyExport export = alertExportService.exportDay("plant-1", scored, REFERENCE);

        Path expectedCsv = tempDir.resolve("plant-1").resolve("alerts_20240115.csv");
        assertThat(export.files().alertFile()).isEqualTo(expectedCsv);
        assertThat(export.files().summaryFile()).isEqualTo(tempDir.resolve("plant-1").resolve("alerts_20240115_summary.json"));
        assertThat(export.alertCount()).isEqualTo(4);
        assertThat(Files.readAllLines(expectedCsv)).hasSize(5);

        assertThat(export.report().getAlerts()).extracting(Alert::getAlertId).containsExactly(1, 2, 3, 4);
        assertThat(export.report().getAlerts().get(3).getSeverity()).isEqualTo("Critical");
        assertThat(export.report().getSummary().getStatus()).isEqualTo("Critical");
    }

    @Test
    void exportWindow_writesOneFilePairPerDayIncludingEmptyDays() throws IOException {
        List<BatchResult> results = batchExportService.exportWindow("plant-1", scored, REFERENCE, 7);

        assertThat(results).hasSize(7).allMatch(BatchResult::isSuccess);
        assertThat(results).extracting(BatchResult::getAlertCount).containsExactly(4, 0, 3, 0, 0, 0, 0);

        Path seriesDir = tempDir.resolve("plant-1");
        String header = String.join(",", Alert.COLUMNS);
        for (int i = 0; i < 7; i++) {
            String stem = alertExportService.fileStem(REFERENCE.minusDays(i));
            assertThat(seriesDir.resolve(stem + ".csv")).exists();
            assertThat(seriesDir.resolve(stem + "_summary.json")).exists();
        }
        assertThat(Files.readAllLines(seriesDir.resolve("alerts_20240114.csv"))).containsExactly(header);

        JsonNode emptySummary = new ObjectMapper().readTree(seriesDir.resolve("alerts_20240114_summary.json").toFile());
        assertThat(emptySummary.get("status").asText()).isEqualTo("Normal");
        assertThat(emptySummary.get("total_alerts").asInt()).isZero();
    }

    @Test
    void exportWindow_oneDayBlockedOnDisk_otherDaysStillWrittenAndPreviousSummaryKept() throws IOException {
        Path seriesDir = tempDir.resolve("plant-1");
        Path blockedCsv = seriesDir.resolve("alerts_20240113.csv");
        Path blockedSummary = seriesDir.resolve("alerts_20240113_summary.json");
        Files.createDirectories(blockedCsv.resolve("occupied"));
        Files.writeString(blockedSummary, "{\"previous\":true}");

        List<BatchResult> results = batchExportService.exportWindow("plant-1", scored, REFERENCE, 7);

        assertThat(results).hasSize(7);
        assertThat(results).extracting(BatchResult::getStatus).containsExactly(
                BatchStatus.SUCCESS, BatchStatus.SUCCESS, BatchStatus.FAILED, BatchStatus.SUCCESS,
                BatchStatus.SUCCESS, BatchStatus.SUCCESS, BatchStatus.SUCCESS);
        assertThat(results.get(2).getError()).isNotBlank();
        assertThat(results.get(2).getFilePath()).isNull();
        assertThat(results).extracting(BatchResult::getAlertCount).containsExactly(4, 0, 0, 0, 0, 0, 0);

        for (LocalDate day : List.of(REFERENCE, REFERENCE.minusDays(1), REFERENCE.minusDays(3), REFERENCE.minusDays(6))) {
            String stem = alertExportService.fileStem(day);
            assertThat(seriesDir.resolve(stem + ".csv")).isRegularFile();
            assertThat(seriesDir.resolve(stem + "_summary.json")).isRegularFile();
        }
        assertThat(Files.readString(blockedSummary)).isEqualTo("{\"previous\":true}");
        assertThat(blockedCsv.resolve("occupied")).isDirectory();
        try (Stream<Path> entries = Files.list(seriesDir)) {
            assertThat(entries.map(p -> p.getFileName().toString())).noneMatch(name -> name.endsWith(".tmp"));
        }
    }
}
