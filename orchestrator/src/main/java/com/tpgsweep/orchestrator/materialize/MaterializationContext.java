package com.tpgsweep.orchestrator.materialize;

import com.tpgsweep.orchestrator.model.StopMode;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Values shared by every unit of a sweep when its directory is built.
 *
 * @param sweepRoot     directory the unit directories are created in
 * @param templateDir   directory holding the base trainParams.json and params.json
 * @param trainingCores thread count written to params.json
 * @param trainingTime  budget written to trainParams.json as timeMaxTraining
 * @param stopMode      stop criterion of the trainer
 * @param nbGenerations generation count written in GENERATIONS mode
 * @param localParams   optional replacement for the template params.json (may be null)
 */
public record MaterializationContext(
        Path     sweepRoot,
        Path     templateDir,
        int      trainingCores,
        Duration trainingTime,
        StopMode stopMode,
        int      nbGenerations,
        Path     localParams) {

    public MaterializationContext {
        Objects.requireNonNull(sweepRoot, "sweepRoot cannot be null");
        Objects.requireNonNull(templateDir, "templateDir cannot be null");
        Objects.requireNonNull(trainingTime, "trainingTime cannot be null");
        Objects.requireNonNull(stopMode, "stopMode cannot be null");
        if (trainingCores < 1) {
            throw new IllegalArgumentException("trainingCores must be >= 1, got " + trainingCores);
        }
    }
}
