package com.tpgsweep.orchestrator.reconcile;

import com.tpgsweep.orchestrator.layout.SweepLayout;
import com.tpgsweep.orchestrator.materialize.ConfigDocuments;
import com.tpgsweep.orchestrator.model.DataType;
import com.tpgsweep.orchestrator.model.ParameterTuple;
import com.tpgsweep.orchestrator.model.UnknownDataTypeException;
import com.tpgsweep.orchestrator.sweep.ParameterSpaceExpander;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fresh inference planning: one config document per trained TPG, core and
 * ISA variant.
 *
 * The data type of a TPG is read from its directory name; the simulator runs
 * the TPG in the type it was trained with. Cores with an FPU are skipped for
 * double and fixed-point TPGs.
 */
@Component
public class InferencePlanner {

    private static final Logger log = LoggerFactory.getLogger(InferencePlanner.class);

    static final String COREV_TOOLCHAIN = "/opt/tools/corev";
    static final String RISCV_TOOLCHAIN = "/opt/tools/riscv";

    private static final Pattern DATA_TYPE_TOKEN =
            Pattern.compile(Pattern.quote(ParameterTuple.DATA_TYPE) + "-([A-Za-z]+)");

    private final SweepLayout              layout;
    private final ConfigDocuments          documents;
    private final InferenceArtifacts       artifacts;
    private final MicroarchitectureCatalog catalog;

    public InferencePlanner(SweepLayout layout, ConfigDocuments documents,
                            InferenceArtifacts artifacts, MicroarchitectureCatalog catalog) {
        this.layout    = layout;
        this.documents = documents;
        this.artifacts = artifacts;
        this.catalog   = catalog;
    }

    /**
     * @param configFiles  every config document written, in planning order
     * @param skippedTpgs  TPG directory names whose data type could not be read
     */
    public record InferencePlan(List<Path> configFiles, List<String> skippedTpgs) {

        public InferencePlan {
            configFiles = List.copyOf(configFiles);
            skippedTpgs = List.copyOf(skippedTpgs);
        }
    }

    private record Planned(Path tpgDir, InferenceConfig config) {}

    /**
     * Plan inference for every TPG under {@code root} and write the configs.
     *
     * @param mini when positive, keep only the first {@code mini} configs of
     *             the whole plan (across all TPGs, in discovery order)
     * @throws IllegalStateException if the root has no training results directory
     */
    public InferencePlan plan(Path root, int mini) {
        List<Planned> planned = new ArrayList<>();
        List<Path> tpgDirs = new ArrayList<>();
        List<String> skipped = new ArrayList<>();

        for (Path tpgDir : artifacts.tpgDirs(root)) {
            String name = tpgDir.getFileName().toString();
            Optional<DataType> dtype = dataTypeOf(name);
            if (dtype.isEmpty()) {
                log.warn("Cannot detect data type of {}, skipping", name);
                skipped.add(name);
                continue;
            }
            tpgDirs.add(tpgDir);
            planned.addAll(configsFor(tpgDir, dtype.get()));
        }

        List<Planned> kept = ParameterSpaceExpander.truncate(planned, mini);
        if (kept.size() < planned.size()) {
            log.info("Mini plan: keeping {} of {} inference configs", kept.size(), planned.size());
        }

        for (Path tpgDir : tpgDirs) {
            createDirectories(tpgDir);
        }
        List<Path> written = new ArrayList<>();
        for (Planned p : kept) {
            Path file = layout.inferenceConfigsDir(p.tpgDir()).resolve(p.config().fileStem() + ".json");
            documents.writeValue(p.config(), file);
            written.add(file);
        }
        log.info("Planned {} inference configs over {} TPGs ({} skipped)",
                written.size(), tpgDirs.size(), skipped.size());
        return new InferencePlan(written, skipped);
    }

    List<Planned> configsFor(Path tpgDir, DataType dtype) {
        String tpg = tpgDir.getFileName().toString();
        List<Planned> configs = new ArrayList<>();
        for (Microarchitecture uarch : catalog.all()) {
            if (!supports(uarch, dtype)) {
                log.debug("Skipping {} on {} (dtype={})", tpg, uarch.name(), dtype);
                continue;
            }
            for (String isa : uarch.expandIsa()) {
                configs.add(new Planned(tpgDir, new InferenceConfig(
                        tpg, uarch.name(), isa, uarch.abi(), dtype.tag(), compilerFor(isa))));
            }
        }
        return configs;
    }

    static boolean supports(Microarchitecture uarch, DataType dtype) {
        return !(uarch.hasFpu() && (dtype == DataType.DOUBLE || dtype == DataType.FIXEDPT));
    }

    /** PULP extensions need the CORE-V toolchain. */
    static String compilerFor(String isa) {
        return isa.toLowerCase(Locale.ROOT).contains("xpulp") ? COREV_TOOLCHAIN : RISCV_TOOLCHAIN;
    }

    static Optional<DataType> dataTypeOf(String tpgDirName) {
        Matcher m = DATA_TYPE_TOKEN.matcher(tpgDirName);
        if (!m.find()) {
            return Optional.empty();
        }
        try {
            return Optional.of(DataType.fromTag(m.group(1)));
        } catch (UnknownDataTypeException e) {
            return Optional.empty();
        }
    }

    private void createDirectories(Path tpgDir) {
        try {
            Files.createDirectories(layout.inferenceConfigsDir(tpgDir));
            Files.createDirectories(layout.inferenceResultsDir(tpgDir));
            Files.createDirectories(layout.inferenceOverlaysDir(tpgDir));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create inference directories under " + tpgDir, e);
        }
    }
}
