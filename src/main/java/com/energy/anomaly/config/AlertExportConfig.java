package com.energy.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "alerts.export")
public class AlertExportConfig {

    // Root directory; each series writes into its own sub-directory.
    private String outputDir = "./exports";

    private String filenamePrefix = "alerts";

    // Rolling window length for batch exports, ending at the reference date.
    private int batchDays = 7;

    // Value of the units_affected column on every alert row.
    private String unitsAffected = "Primary System";

    private Schedule schedule = new Schedule();

    @Data
    public static class Schedule {
        private boolean enabled = true;
        private String cron = "0 5 0 * * *";
    }
}
