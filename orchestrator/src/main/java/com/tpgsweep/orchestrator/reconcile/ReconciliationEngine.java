package com.tpgsweep.orchestrator.reconcile;

import com.tpgsweep.orchestrator.layout.SweepLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resume support: works out which planned inference runs have no result yet.
 *
 * A config and a result match when they share the owning TPG directory and
 * the file stem ({@code <uarch>_<isa>_<abi>_<dtype>}). Missing is the set of
 * configs without a matching result.
 */
@Component
public class ReconciliationEngine {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationEngine.class);

    private final SweepLayout        layout;
    private final InferenceArtifacts artifacts;

    public ReconciliationEngine(SweepLayout layout, InferenceArtifacts artifacts) {
        this.layout    = layout;
        this.artifacts = artifacts;
    }

    /**
     * @param missing configs still lacking a result, sorted by path
     */
    public record ResumePlan(int expected, int present, List<Path> missing) {

        public ResumePlan {
            missing = List.copyOf(missing);
        }

        public boolean complete() { return missing.isEmpty(); }
    }

    /**
     * @throws IllegalStateException if the root has no training results directory
     */
    public ResumePlan reconcile(Path root) {
        List<Path> configs = artifacts.configFiles(root);
        List<Path> results = artifacts.resultFiles(root);
        List<Path> missing = missing(configs, results);
        log.info("Reconciled {}: {} configs, {} results, {} missing",
                root, configs.size(), results.size(), missing.size());
        return new ResumePlan(configs.size(), results.size(), missing);
    }

    /** Expected minus actual, by artifact key. */
    public List<Path> missing(List<Path> configs, List<Path> results) {
        Set<String> done = new HashSet<>();
        for (Path result : results) {
            done.add(key(result));
        }
        Map<String, Path> expected = new LinkedHashMap<>();
        for (Path config : configs) {
            expected.put(key(config), config);
        }
        expected.keySet().removeAll(done);
        return expected.values().stream().sorted().toList();
    }

    /**
     * Write the missing config paths, one per line.
     */
    public Path writeMissingList(ResumePlan plan, Path file) {
        List<String> lines = plan.missing().stream()
                .map(Path::toString)
                .filter(line -> !line.isBlank())
                .toList();
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            Files.write(file, lines);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write resume list " + file, e);
        }
        log.info("Resume list with {} entries written to {}", lines.size(), file);
        return file;
    }

    /** TPG directory a missing config belongs to, as the dispatcher needs it. */
    public Path owningTpgDir(Path config) {
        return layout.tpgDirOfInferenceArtifact(config);
    }

    String key(Path artifact) {
        String file = artifact.getFileName().toString();
        int dot = file.lastIndexOf('.');
        String stem = dot > 0 ? file.substring(0, dot) : file;
        return owningTpgDir(artifact).resolve(stem).toString();
    }
}
