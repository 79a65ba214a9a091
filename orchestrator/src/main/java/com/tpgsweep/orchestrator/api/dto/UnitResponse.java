package com.tpgsweep.orchestrator.api.dto;

import com.tpgsweep.orchestrator.model.ExperimentUnit;
import com.tpgsweep.orchestrator.model.UnitState;

import java.time.Instant;

/**
 * Read-only view of an experiment unit returned by GET /sweeps/{id}/units.
 */
public record UnitResponse(
        String    id,
        UnitState state,
        String    workDir,
        int       seed,
        String    dataType,
        String    instructionSet,
        String    schedulerJobId,
        String    failureReason,
        Instant   updatedAt
) {
    public static UnitResponse from(ExperimentUnit u) {
        return new UnitResponse(
                u.getId(),
                u.getState(),
                u.getWorkDir().toString(),
                u.getTuple().seed(),
                u.getTuple().dataType().tag(),
                u.getTuple().instructionSetName(),
                u.getSchedulerJobId(),
                u.getFailureReason(),
                u.getUpdatedAt()
        );
    }
}
