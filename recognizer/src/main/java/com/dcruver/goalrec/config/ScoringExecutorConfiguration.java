package com.dcruver.goalrec.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool for scoring hypotheses concurrently.
 */
@Configuration
@Slf4j
public class ScoringExecutorConfiguration {

    @Bean(name = "scoringExecutor")
    public ThreadPoolTaskExecutor scoringExecutor(RecognizerProperties properties) {
        int threads = Math.max(1, properties.getScoringThreads());
        log.info("Creating scoring executor with {} threads", threads);

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setThreadNamePrefix("scoring-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
