package com.tpgsweep.orchestrator.dispatch;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * A self-contained request for the batch scheduler: run {@code command}
 * inside {@code image} with the given mounts and resources.
 *
 * @param name       job name shown by the scheduler
 * @param stage      which tool this job runs
 * @param image      container image the command runs in
 * @param command    command line inside the container
 * @param resources  cpus, memory and wall-time ceiling
 * @param bindMounts directories exposed to the container (configuration in, artifacts out)
 * @param workDir    job working directory; scheduler logs land here
 */
public record JobRequest(
        String          name,
        JobStage        stage,
        String          image,
        List<String>    command,
        ResourceSpec    resources,
        List<BindMount> bindMounts,
        Path            workDir) {

    public JobRequest {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(stage, "stage cannot be null");
        Objects.requireNonNull(image, "image cannot be null");
        Objects.requireNonNull(resources, "resources cannot be null");
        Objects.requireNonNull(workDir, "workDir cannot be null");
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command cannot be empty");
        }
        command    = List.copyOf(command);
        bindMounts = bindMounts == null ? List.of() : List.copyOf(bindMounts);
    }
}
