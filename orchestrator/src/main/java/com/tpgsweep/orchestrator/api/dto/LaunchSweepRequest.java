package com.tpgsweep.orchestrator.api.dto;

import com.tpgsweep.orchestrator.model.DataType;
import com.tpgsweep.orchestrator.model.InstructionSet;
import com.tpgsweep.orchestrator.sweep.SweepDefinition;

import java.util.List;

/**
 * Request body for POST /sweeps.
 *
 * Required: seedTo, instructionSets, dataTypes
 * Optional: seedFrom (defaults to 0), mini (defaults to 0, i.e. the full product)
 *
 * dataTypes are tags as written in trainParams.json: "double", "float", "int", "fixedpt".
 */
public record LaunchSweepRequest(Integer seedFrom,
                                 Integer seedTo,
                                 List<InstructionSet> instructionSets,
                                 List<String> dataTypes,
                                 Integer mini) {

    public LaunchSweepRequest {
        if (seedFrom == null) seedFrom = 0;
        if (mini == null)     mini = 0;
    }

    /**
     * @throws IllegalArgumentException if a field is missing or invalid
     */
    public SweepDefinition toDefinition() {
        if (seedTo == null)          throw new IllegalArgumentException("seedTo is required");
        if (instructionSets == null) throw new IllegalArgumentException("instructionSets is required");
        if (dataTypes == null)       throw new IllegalArgumentException("dataTypes is required");
        List<DataType> types = dataTypes.stream().map(DataType::fromTag).toList();
        return new SweepDefinition(seedFrom, seedTo, instructionSets, types, mini);
    }
}
