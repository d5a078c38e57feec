package com.energy.anomaly.model;

import java.nio.file.Path;

/**
 * Paths written for one exported day: the alert rows and the companion summary.
 */
public record ExportFiles(Path alertFile, Path summaryFile) {}
