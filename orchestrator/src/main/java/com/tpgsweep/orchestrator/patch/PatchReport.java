package com.tpgsweep.orchestrator.patch;

import com.tpgsweep.orchestrator.layout.GeneratedFile;
import com.tpgsweep.orchestrator.model.DataType;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Outcome of patching one unit.
 *
 * @param appliedRules per rewritten file, the names of the rules that changed it
 * @param unchanged    files present but already in target form
 * @param missing      files the generator did not produce
 */
public record PatchReport(
        Path                             unitDir,
        DataType                         target,
        Map<GeneratedFile, List<String>> appliedRules,
        List<GeneratedFile>              unchanged,
        List<GeneratedFile>              missing) {

    public PatchReport {
        appliedRules = Map.copyOf(appliedRules);
        unchanged    = List.copyOf(unchanged);
        missing      = List.copyOf(missing);
    }

    public boolean changedAnything() { return !appliedRules.isEmpty(); }
}
