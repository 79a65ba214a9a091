package com.tpgsweep.orchestrator.materialize;

/**
 * Thrown when a unit's work directory cannot be built.
 *
 * Unchecked: the sweep service catches it per unit and marks that unit
 * FAILED; sibling units carry on.
 */
public class MaterializationException extends RuntimeException {

    public enum Kind { TEMPLATE_MISSING, IO_ERROR, MALFORMED_CONFIG }

    private final Kind kind;

    public MaterializationException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public MaterializationException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
