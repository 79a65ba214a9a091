package com.tpgsweep.orchestrator.api.dto;

import com.tpgsweep.orchestrator.model.SweepRun;
import com.tpgsweep.orchestrator.model.UnitState;

import java.time.Instant;
import java.util.UUID;

/**
 * Response body for POST /sweeps and GET /sweeps/{id}.
 * resultsFile is set once aggregation has written the table.
 */
public record SweepResponse(
        UUID    id,
        String  state,
        String  root,
        int     units,
        long    completed,
        long    failed,
        String  resultsFile,
        Instant createdAt,
        Instant finishedAt
) {
    public static SweepResponse from(SweepRun run) {
        return new SweepResponse(
                run.getId(),
                run.getState().name(),
                run.getRoot().toString(),
                run.getUnits().size(),
                run.countIn(UnitState.COMPLETED),
                run.countIn(UnitState.FAILED),
                run.getResultsFile() == null ? null : run.getResultsFile().toString(),
                run.getCreatedAt(),
                run.getFinishedAt()
        );
    }
}
