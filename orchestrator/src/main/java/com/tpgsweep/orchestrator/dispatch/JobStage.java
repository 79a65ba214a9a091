package com.tpgsweep.orchestrator.dispatch;

/**
 * The containerised tools a unit passes through, in order.
 */
public enum JobStage {
    TRAIN,
    CODEGEN,
    INFERENCE;

    public String tag() {
        return name().toLowerCase();
    }
}
