package com.dcruver.goalrec.io;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON description of a batch of hypotheses scored against one model.
 * Relative paths are resolved against the manifest's directory.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class BatchManifest {
    private String model;
    private String observability;          // FULL or PARTIAL, defaults from configuration
    private Double detectionProbability;   // Defaults from configuration
    private String observationFile;
    private Integer observationCount;
    private List<Entry> hypotheses = new ArrayList<>();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Entry {
        private String hypothesis;
        private String observationLog;
        private String baselineLog;
    }
}
