package com.tpgsweep.orchestrator.model;

/**
 * Thrown when a data type tag in a config or directory name matches none of
 * the supported arithmetic types.
 */
public class UnknownDataTypeException extends IllegalArgumentException {

    private final String tag;

    public UnknownDataTypeException(String tag) {
        super("Unrecognised data type tag: '" + tag + "'");
        this.tag = tag;
    }

    public String getTag() { return tag; }
}
