package com.tpgsweep.orchestrator.reconcile;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One simulator run: a trained TPG on one microarchitecture / ISA / ABI /
 * data type / compiler combination. Serialised as the config document the
 * simulator job reads.
 *
 * @param tpg      name of the TPG directory under training_results
 * @param compiler toolchain root inside the simulator image
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record InferenceConfig(
        String tpg,
        String uarch,
        String isa,
        String abi,
        String dtype,
        String compiler) {

    /** File stem shared by the config and the result document. */
    public String fileStem() {
        return uarch + "_" + isa + "_" + abi + "_" + dtype;
    }

    public InferenceKey key() {
        return new InferenceKey(tpg, uarch, isa, abi, dtype, compiler);
    }
}
