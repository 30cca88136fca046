package com.dcruver.goalrec;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the HTN goal recognizer.
 *
 * Scores goal hypotheses against an observed action sequence: each hypothesis
 * gets a normalized likelihood from its observation-consistent and baseline
 * plans, and the likelihoods are normalized into a posterior.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@Slf4j
public class GoalRecognizerApplication {

    public static void main(String[] args) {
        log.info("Starting HTN Goal Recognizer...");
        SpringApplication.run(GoalRecognizerApplication.class, args);
    }
}
