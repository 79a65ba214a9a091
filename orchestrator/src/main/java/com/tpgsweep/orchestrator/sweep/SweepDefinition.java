package com.tpgsweep.orchestrator.sweep;

import com.tpgsweep.orchestrator.model.DataType;
import com.tpgsweep.orchestrator.model.InstructionSet;

import java.util.List;
import java.util.Objects;
import java.util.stream.IntStream;

/**
 * The dimensions of one sweep.
 *
 * @param seedFrom        first seed (inclusive)
 * @param seedTo          last seed (exclusive)
 * @param instructionSets instruction sets to train with
 * @param dataTypes       arithmetic types to train with
 * @param mini            when &gt; 0, keep at most this many values of each
 *                        dimension before taking the product; 0 keeps all
 */
public record SweepDefinition(
        int                  seedFrom,
        int                  seedTo,
        List<InstructionSet> instructionSets,
        List<DataType>       dataTypes,
        int                  mini) {

    public SweepDefinition {
        Objects.requireNonNull(instructionSets, "instructionSets cannot be null");
        Objects.requireNonNull(dataTypes, "dataTypes cannot be null");
        if (seedTo <= seedFrom) {
            throw new IllegalArgumentException(
                    "seed range [%d, %d) is empty".formatted(seedFrom, seedTo));
        }
        if (instructionSets.isEmpty()) {
            throw new IllegalArgumentException("at least one instruction set is required");
        }
        if (dataTypes.isEmpty()) {
            throw new IllegalArgumentException("at least one data type is required");
        }
        if (mini < 0) {
            throw new IllegalArgumentException("mini must be >= 0, got " + mini);
        }
        instructionSets = List.copyOf(instructionSets);
        dataTypes       = List.copyOf(dataTypes);
    }

    public List<Integer> seeds() {
        return IntStream.range(seedFrom, seedTo).boxed().toList();
    }
}
