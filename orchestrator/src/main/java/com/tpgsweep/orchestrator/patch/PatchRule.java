package com.tpgsweep.orchestrator.patch;

import com.tpgsweep.orchestrator.model.DataType;

/**
 * One text transformation over a generated C file.
 *
 * Rules see the whole file content and return the rewritten content, or the
 * input unchanged when nothing matches. Applying a rule to its own output
 * must change nothing.
 */
public interface PatchRule {

    /** Short identifier used in logs and patch reports. */
    String name();

    String apply(String source, DataType target);
}
