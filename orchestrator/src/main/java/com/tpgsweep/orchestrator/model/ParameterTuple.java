package com.tpgsweep.orchestrator.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One point of the sweep: a seed, an instruction set and a data type.
 */
public record ParameterTuple(int seed, InstructionSet instructionSet, DataType dataType) {

    public static final String SEED = "seed";
    public static final String DATA_TYPE = "instrType";
    public static final String INSTRUCTION_SET_NAME = "instrSetName";

    public ParameterTuple {
        Objects.requireNonNull(instructionSet, "instructionSet cannot be null");
        Objects.requireNonNull(dataType, "dataType cannot be null");
    }

    /**
     * Fields that identify the experiment and override trainParams.json.
     * The instruction set name is excluded: it is decoration only.
     */
    public Map<String, Object> identityFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(SEED, seed);
        fields.putAll(instructionSet.flags());
        fields.put(DATA_TYPE, dataType.tag());
        return fields;
    }

    public String instructionSetName() {
        return instructionSet.name();
    }
}
