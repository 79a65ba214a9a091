package com.tpgsweep.orchestrator.aggregate;

import java.nio.file.Path;

/**
 * One simulator result document, reduced to the fields the summary tables need.
 *
 * @param tpgDirName name of the owning TPG directory, seed included
 * @param seed       seed parsed from the directory name, null if absent
 */
public record InferenceResult(
        Path   source,
        String tpgDirName,
        String canonicalTpg,
        Integer seed,
        String simulator,
        String isa,
        String abi,
        String dtype,
        double meanLatency,
        double stddevLatency) {}
