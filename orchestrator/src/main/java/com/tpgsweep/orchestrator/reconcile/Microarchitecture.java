package com.tpgsweep.orchestrator.reconcile;

import java.util.List;
import java.util.Locale;

/**
 * A simulated core configuration.
 *
 * @param isa ISA string; {@code (c)} marks an optional compressed extension,
 *            e.g. {@code rv32im(c)_zicsr}
 */
public record Microarchitecture(String name, String isa, String abi) {

    static final String OPTIONAL_COMPRESSED = "(c)";

    public Microarchitecture {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("name is required");
        if (isa == null || isa.isBlank())   throw new IllegalArgumentException("isa is required for " + name);
        if (abi == null || abi.isBlank())   throw new IllegalArgumentException("abi is required for " + name);
    }

    /** Cores with a hardware FPU carry "fpu" in their name. */
    public boolean hasFpu() {
        return name.toLowerCase(Locale.ROOT).contains("fpu");
    }

    /**
     * {@code rv32im(c)_zicsr} gives {@code rv32im_zicsr} and {@code rv32imc_zicsr};
     * an ISA without the marker gives itself.
     */
    public List<String> expandIsa() {
        int at = isa.indexOf(OPTIONAL_COMPRESSED);
        if (at < 0) {
            return List.of(isa);
        }
        String base = isa.substring(0, at);
        String suffix = isa.substring(at + OPTIONAL_COMPRESSED.length()).replace(OPTIONAL_COMPRESSED, "");
        return List.of(base + suffix, base + "c" + suffix);
    }
}
