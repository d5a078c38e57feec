package com.energy.anomaly.repository;

import com.energy.anomaly.model.Alert;
import com.energy.anomaly.model.DailyAlertReport;
import com.energy.anomaly.model.ExportFiles;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes a day's alerts as CSV and its summary as JSON, sharing one file stem:
 * {@code <stem>.csv} and {@code <stem>_summary.json}.
 *
 * Both files are written to temporary siblings first and only then moved into place,
 * so a failed write leaves the previous pair (or nothing) behind.
 */
@Repository
public class AlertExportRepository {

    private static final Logger log = LoggerFactory.getLogger(AlertExportRepository.class);

    public static final String ALERT_SUFFIX = ".csv";
    public static final String SUMMARY_SUFFIX = "_summary.json";

    private static final String LINE_SEPARATOR = "\n";

    private final CsvMapper csvMapper;
    private final CsvSchema alertSchema;
    private final ObjectMapper objectMapper;

    public AlertExportRepository() {
        this.csvMapper = new CsvMapper();
        SimpleModule plainNumbers = new SimpleModule("plain-decimal-csv");
        plainNumbers.addSerializer(Double.class, new PlainDecimalSerializer());
        plainNumbers.addSerializer(Double.TYPE, new PlainDecimalSerializer());
        csvMapper.registerModule(plainNumbers);
        CsvSchema.Builder schema = CsvSchema.builder().setLineSeparator(LINE_SEPARATOR);
        for (String column : Alert.COLUMNS) {
            schema.addColumn(column);
        }
        this.alertSchema = schema.build().withoutHeader();
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public ExportFiles save(Path directory, String stem, DailyAlertReport report) throws IOException {
        Files.createDirectories(directory);
        Path alertFile = directory.resolve(stem + ALERT_SUFFIX);
        Path summaryFile = directory.resolve(stem + SUMMARY_SUFFIX);

        Path alertTmp = null;
        Path summaryTmp = null;
        try {
            alertTmp = writeTemp(alertFile, out -> writeAlerts(out, report));
            summaryTmp = writeTemp(summaryFile, out -> objectMapper.writeValue(out, report.getSummary()));
            moveIntoPlace(alertTmp, alertFile);
            moveIntoPlace(summaryTmp, summaryFile);
        } finally {
            deleteIfPresent(alertTmp);
            deleteIfPresent(summaryTmp);
        }

        if (report.isEmpty()) {
            log.info("No alerts found for {}. Created empty file: {}", report.getDate(), alertFile);
        } else {
            log.info("Exported {} alerts to {}", report.getAlertCount(), alertFile);
        }
        return new ExportFiles(alertFile, summaryFile);
    }

    // Header first, always, so empty days carry the same columns as busy ones.
    private void writeAlerts(Writer out, DailyAlertReport report) throws IOException {
        out.write(String.join(String.valueOf(alertSchema.getColumnSeparator()), Alert.COLUMNS));
        out.write(LINE_SEPARATOR);
        if (report.isEmpty()) {
            return;
        }
        try (SequenceWriter rows = csvMapper.writer(alertSchema).writeValues(out)) {
            rows.writeAll(report.getAlerts());
        }
    }

    private Path writeTemp(Path target, ContentWriter content) throws IOException {
        Path tmp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
        try (Writer out = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
            content.write(out);
        } catch (IOException | RuntimeException e) {
            Files.deleteIfExists(tmp);
            throw e;
        }
        return tmp;
    }

    private void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to plain replace", target);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteIfPresent(Path tmp) throws IOException {
        if (tmp != null) {
            Files.deleteIfExists(tmp);
        }
    }

    /**
     * Plain decimal text for CSV cells: {@code 0.0001} rather than {@code 1.0E-4}.
     * Whole numbers keep one decimal place ({@code 500.0}).
     */
    static String plainDecimal(double value) {
        String plain = BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
        return plain.indexOf('.') < 0 ? plain + ".0" : plain;
    }

    private static final class PlainDecimalSerializer extends StdSerializer<Double> {

        PlainDecimalSerializer() {
            super(Double.class);
        }

        @Override
        public void serialize(Double value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            if (value.isNaN() || value.isInfinite()) {
                gen.writeNumber(value.doubleValue());
            } else {
                gen.writeNumber(plainDecimal(value));
            }
        }
    }

    @FunctionalInterface
    private interface ContentWriter {
        void write(Writer out) throws IOException;
    }
}
