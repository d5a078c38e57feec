package com.energy.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelMetadata {

    private String seriesId;

    private String detector;

    private int treeCount;

    private List<String> featureNames;

    private int trainingSamples;

    private double contamination;

    private long randomSeed;

    private long trainedAt;
}
