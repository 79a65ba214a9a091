package com.tpgsweep.orchestrator.layout;

/**
 * The four C files the code generator writes for one trained TPG.
 */
public enum GeneratedFile {
    /** Graph traversal: bestProgram(), inferenceTPG(), T&lt;n&gt;Scores. */
    GRAPH_SOURCE,
    /** Forward declaration of inferenceTPG(). */
    GRAPH_HEADER,
    /** Program bodies P&lt;n&gt;() and the extern inputs they read. */
    PROGRAM_SOURCE,
    /** Forward declarations of P&lt;n&gt;(). */
    PROGRAM_HEADER;

    public boolean isHeader() {
        return this == GRAPH_HEADER || this == PROGRAM_HEADER;
    }
}
