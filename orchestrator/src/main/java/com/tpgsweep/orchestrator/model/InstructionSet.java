package com.tpgsweep.orchestrator.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A named selection of instruction families offered to the trainer.
 *
 * @param name  display name, written to trainParams.json as {@code instrSetName}
 *              but not part of the experiment id
 * @param flags instruction toggles such as {@code useInstrTrig}, in declaration order
 */
public record InstructionSet(String name, Map<String, Boolean> flags) {

    public InstructionSet {
        Objects.requireNonNull(name, "name cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("instruction set name cannot be blank");
        }
        flags = flags == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(flags));
    }
}
