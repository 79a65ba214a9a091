package com.tpgsweep.orchestrator.patch;

/**
 * Thrown when a unit's generated code cannot be specialised.
 *
 * Only the patch step of that unit fails; its training metrics are kept.
 */
public class PatchException extends RuntimeException {

    public enum Kind { CONFIG_MISSING, UNKNOWN_TYPE, IO_ERROR }

    private final Kind kind;

    public PatchException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public PatchException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
