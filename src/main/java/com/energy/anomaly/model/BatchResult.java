package com.energy.anomaly.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Outcome of exporting a single day within a batch. Failed days carry the error
 * message and no file path.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BatchResult {

    private LocalDate date;

    private String filePath;

    private int alertCount;

    private BatchStatus status;

    private String error;

    public static BatchResult success(LocalDate date, String filePath, int alertCount) {
        return BatchResult.builder()
                .date(date)
                .filePath(filePath)
                .alertCount(alertCount)
                .status(BatchStatus.SUCCESS)
                .build();
    }

    public static BatchResult failed(LocalDate date, String error) {
        return BatchResult.builder()
                .date(date)
                .alertCount(0)
                .status(BatchStatus.FAILED)
                .error(error)
                .build();
    }

    public boolean isSuccess() {
        return status == BatchStatus.SUCCESS;
    }
}
