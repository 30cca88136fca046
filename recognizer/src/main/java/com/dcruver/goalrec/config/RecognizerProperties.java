package com.dcruver.goalrec.config;

import com.dcruver.goalrec.domain.scoring.ObservabilityMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Defaults for scoring runs, bound from the "recognizer" prefix.
 */
@Component
@ConfigurationProperties(prefix = "recognizer")
@Data
public class RecognizerProperties {
    private ObservabilityMode observability = ObservabilityMode.FULL;
    private double detectionProbability = 0.9;
    private int scoringThreads = 4;
    private String reportDir = "reports";
}
