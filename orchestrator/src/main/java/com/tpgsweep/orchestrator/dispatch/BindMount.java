package com.tpgsweep.orchestrator.dispatch;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A host directory exposed inside the job's container.
 */
public record BindMount(Path hostPath, String containerPath, boolean readOnly) {

    public BindMount {
        Objects.requireNonNull(hostPath, "hostPath cannot be null");
        Objects.requireNonNull(containerPath, "containerPath cannot be null");
    }

    public static BindMount readWrite(Path hostPath, String containerPath) {
        return new BindMount(hostPath, containerPath, false);
    }

    public static BindMount readOnly(Path hostPath, String containerPath) {
        return new BindMount(hostPath, containerPath, true);
    }

    /** Value of apptainer's {@code --bind} option. */
    public String toBindSpec() {
        return hostPath.toAbsolutePath() + ":" + containerPath + (readOnly ? ":ro" : "");
    }
}
