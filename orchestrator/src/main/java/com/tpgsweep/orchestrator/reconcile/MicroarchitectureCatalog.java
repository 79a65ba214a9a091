package com.tpgsweep.orchestrator.reconcile;

import com.tpgsweep.orchestrator.config.SweepProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The CV32E family cores the simulator image can run, in planning order.
 *
 * {@code tpgsweep.inference.microarchitectures} narrows the catalog to the
 * named cores; an empty list keeps all of them.
 */
@Component
public class MicroarchitectureCatalog {

    static final List<Microarchitecture> DEFAULTS = List.of(
            new Microarchitecture("cv32e20_im0", "rv32i(c)_zicsr", "ilp32"),
            new Microarchitecture("cv32e20_im1", "rv32im(c)_zicsr", "ilp32"),
            new Microarchitecture("cv32e20_im2", "rv32im(c)_zicsr", "ilp32"),
            new Microarchitecture("cv32e20_im3", "rv32im(c)_zicsr", "ilp32"),

            new Microarchitecture("cv32e20_em0", "rv32e(c)_zicsr", "ilp32e"),
            new Microarchitecture("cv32e20_em1", "rv32em(c)_zicsr", "ilp32e"),
            new Microarchitecture("cv32e20_em2", "rv32em(c)_zicsr", "ilp32e"),
            new Microarchitecture("cv32e20_em3", "rv32em(c)_zicsr", "ilp32e"),

            new Microarchitecture("cv32e40x_im0", "rv32i(c)_zicsr", "ilp32"),
            new Microarchitecture("cv32e40x_im1", "rv32i(c)_zicsr_zmmul", "ilp32"),
            new Microarchitecture("cv32e40x_im2", "rv32im(c)_zicsr", "ilp32"),

            new Microarchitecture("cv32e40x_em0", "rv32e(c)_zicsr", "ilp32e"),
            new Microarchitecture("cv32e40x_em1", "rv32e(c)_zicsr_zmmul", "ilp32e"),
            new Microarchitecture("cv32e40x_em2", "rv32em(c)_zicsr", "ilp32e"),

            new Microarchitecture("cv32e40px", "rv32im(c)_zicsr", "ilp32"),
            new Microarchitecture("cv32e40px_fpu", "rv32imf(c)_zicsr", "ilp32f"),
            new Microarchitecture("cv32e40px_corev_pulp", "rv32im(c)_zicsr_xpulp", "ilp32f"),
            new Microarchitecture("cv32e40px_corev_pulp_fpu", "rv32imf(c)_zicsr_xpulp", "ilp32f"),

            new Microarchitecture("cv32e40p", "rv32im(c)_zicsr", "ilp32"),
            new Microarchitecture("cv32e40p_corev_pulp", "rv32im(c)_zicsr_xpulp", "ilp32"));

    private final List<Microarchitecture> selected;

    @Autowired
    public MicroarchitectureCatalog(SweepProperties props) {
        this(props.inference() == null ? List.of() : props.inference().microarchitectures());
    }

    /**
     * @throws IllegalArgumentException if a name is not in the catalog
     */
    public MicroarchitectureCatalog(List<String> names) {
        this.selected = select(names);
    }

    public List<Microarchitecture> all() {
        return selected;
    }

    private static List<Microarchitecture> select(List<String> names) {
        if (names == null || names.isEmpty()) {
            return DEFAULTS;
        }
        Map<String, Microarchitecture> byName = new LinkedHashMap<>();
        DEFAULTS.forEach(u -> byName.put(u.name(), u));

        List<Microarchitecture> chosen = new ArrayList<>();
        for (String name : names) {
            Microarchitecture u = byName.get(name);
            if (u == null) {
                throw new IllegalArgumentException("Unknown microarchitecture: " + name);
            }
            chosen.add(u);
        }
        return List.copyOf(chosen);
    }
}
