package com.tpgsweep.orchestrator.dispatch;

import com.tpgsweep.orchestrator.model.StopMode;

import java.time.Duration;

/**
 * Wall time requested for a training job.
 *
 * In TIME mode the trainer checks its budget only between generations, so a
 * generation started just before the deadline runs over it; the margin covers
 * that. In GENERATIONS mode run time is not known up front, and the scheduler
 * still needs a hard cap, so a fixed ceiling is requested.
 */
public final class WallTimePolicy {

    private WallTimePolicy() {}

    public static Duration training(StopMode mode, Duration trainingTime,
                                    Duration safetyMargin, Duration generationCeiling) {
        return switch (mode) {
            case TIME        -> trainingTime.plus(safetyMargin);
            case GENERATIONS -> generationCeiling;
        };
    }
}
