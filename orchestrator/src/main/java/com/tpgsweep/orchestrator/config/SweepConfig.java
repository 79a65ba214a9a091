package com.tpgsweep.orchestrator.config;

import com.tpgsweep.orchestrator.layout.SweepLayout;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Beans derived from {@link SweepProperties}.
 */
@Configuration
public class SweepConfig {

    @Bean
    SweepLayout sweepLayout(SweepProperties properties) {
        return properties.layout() != null ? properties.layout() : SweepLayout.standard();
    }

    /**
     * Threads that block on scheduler submissions, one job each.
     * The scheduler does the real work; this only caps how many jobs we wait on.
     */
    @Bean(destroyMethod = "shutdownNow")
    ExecutorService dispatchWorkers(SweepProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.scheduler().maxInFlight()));
    }
}
