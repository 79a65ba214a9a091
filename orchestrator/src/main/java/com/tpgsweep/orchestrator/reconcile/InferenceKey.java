package com.tpgsweep.orchestrator.reconcile;

/**
 * Identity of one expected inference result.
 */
public record InferenceKey(
        String tpgId,
        String microarchitecture,
        String isa,
        String abi,
        String dataType,
        String compiler) {}
