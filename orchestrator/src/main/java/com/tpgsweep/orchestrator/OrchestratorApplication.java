package com.tpgsweep.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Sweep orchestrator: expands a TPG parameter space, runs every point
 * through the trainer and code generator on Slurm, and collects the results.
 *
 * To run:
 *   TPGSWEEP_ROOT=/scratch/tpg_expe mvn -pl orchestrator spring-boot:run
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class OrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrchestratorApplication.class, args);
    }
}
