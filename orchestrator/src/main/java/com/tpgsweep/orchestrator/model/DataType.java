package com.tpgsweep.orchestrator.model;

import java.util.Arrays;
import java.util.Locale;

/**
 * Arithmetic representation a TPG is trained with and its inference code is
 * specialised to.
 *
 * The tag is both the value of {@code instrType} in trainParams.json and the
 * C type keyword written into generated code.
 */
public enum DataType {
    DOUBLE("double"),
    FLOAT("float"),
    INT("int"),
    FIXEDPT("fixedpt");

    /** The type the code generator always emits before patching. */
    public static final DataType GENERATOR_DEFAULT = DOUBLE;

    private final String tag;

    DataType(String tag) {
        this.tag = tag;
    }

    public String tag() { return tag; }

    /**
     * Whether generated code may seed its running best with NaN / -INFINITY.
     * Only integer code has to drop it.
     */
    public boolean keepsSentinelIdiom() {
        return this != INT;
    }

    /**
     * Resolve a config tag ("float", "int", ...). Case-insensitive.
     *
     * @throws UnknownDataTypeException if the tag names no known type
     */
    public static DataType fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new UnknownDataTypeException(tag);
        }
        String normalized = tag.strip().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(t -> t.tag.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new UnknownDataTypeException(tag));
    }

    @Override
    public String toString() {
        return tag;
    }
}
