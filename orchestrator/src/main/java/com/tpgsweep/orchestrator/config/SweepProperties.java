package com.tpgsweep.orchestrator.config;

import com.tpgsweep.orchestrator.layout.SweepLayout;
import com.tpgsweep.orchestrator.model.StopMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Everything under {@code tpgsweep.*} in application.yml.
 *
 * Paths are explicit values handed to every component; nothing resolves
 * against the process working directory.
 *
 * @param root        directory experiment units are materialised in
 * @param templateDir directory holding the base trainParams.json / params.json
 */
@ConfigurationProperties(prefix = "tpgsweep")
public record SweepProperties(
        Path        root,
        Path        templateDir,
        SweepLayout layout,
        Training    training,
        Scheduler   scheduler,
        Inference   inference) {

    /**
     * Global resource parameters applied to every training unit.
     *
     * @param cores         written to params.json as nbThreads and requested per job
     * @param time          training time budget, written as timeMaxTraining (seconds)
     * @param stopMode      whether the trainer stops on time or on generation count
     * @param nbGenerations generation count used in GENERATIONS mode
     * @param localParams   optional params.json replacing the template's, ignored if absent
     */
    public record Training(
            int      cores,
            Duration time,
            StopMode stopMode,
            int      nbGenerations,
            Path     localParams) {}

    /**
     * Batch scheduler and container settings.
     *
     * @param safetyMargin      added to the training time in TIME mode; the trainer
     *                          only checks its budget between generations
     * @param generationCeiling wall time requested in GENERATIONS mode
     * @param maxInFlight       jobs this process waits on concurrently
     * @param pollInterval      delay between two sacct queries for one job
     */
    public record Scheduler(
            String       sbatch,
            String       sacct,
            String       scancel,
            String       apptainer,
            Duration     pollInterval,
            String       partition,
            int          maxInFlight,
            int          memoryMb,
            Duration     safetyMargin,
            Duration     generationCeiling,
            Duration     codegenWallTime,
            Duration     inferenceWallTime,
            String       trainerImage,
            List<String> trainerCommand,
            String       codegenImage,
            List<String> codegenCommand,
            String       simulatorImage,
            List<String> simulatorCommand,
            Path         simulatorsDir) {}

    /**
     * Inference sweep settings.
     *
     * @param microarchitectures catalog entries to simulate; empty means all
     * @param missingListFile    name of the resume list written under the root
     */
    public record Inference(
            List<String> microarchitectures,
            String       missingListFile) {}
}
