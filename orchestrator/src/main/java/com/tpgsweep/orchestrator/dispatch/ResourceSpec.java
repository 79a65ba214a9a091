package com.tpgsweep.orchestrator.dispatch;

import java.time.Duration;
import java.util.Objects;

/**
 * What a job asks the scheduler for.
 */
public record ResourceSpec(int cpus, int memoryMb, Duration wallTime) {

    public ResourceSpec {
        Objects.requireNonNull(wallTime, "wallTime cannot be null");
        if (cpus < 1) {
            throw new IllegalArgumentException("cpus must be >= 1, got " + cpus);
        }
        if (wallTime.isNegative() || wallTime.isZero()) {
            throw new IllegalArgumentException("wallTime must be positive, got " + wallTime);
        }
    }

    /** Slurm {@code --time} format: D-HH:MM:SS, rounded up to the next second. */
    public String slurmTime() {
        long total = wallTime.toSeconds() + (wallTime.toNanosPart() > 0 ? 1 : 0);
        long days  = total / 86_400;
        long hours = (total % 86_400) / 3_600;
        long mins  = (total % 3_600) / 60;
        long secs  = total % 60;
        return "%d-%02d:%02d:%02d".formatted(days, hours, mins, secs);
    }
}
