package com.tpgsweep.orchestrator.materialize;

import com.tpgsweep.orchestrator.layout.SweepLayout;
import com.tpgsweep.orchestrator.model.ExperimentUnit;
import com.tpgsweep.orchestrator.model.ParameterTuple;
import com.tpgsweep.orchestrator.model.StopMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;

/**
 * Turns a parameter tuple into a self-contained work directory.
 *
 * <pre>
 *   &lt;id&gt;/params/trainParams.json   template + tuple overrides, comments stripped
 *   &lt;id&gt;/params/params.json        template (or local override) with nbThreads set
 *   &lt;id&gt;/outLogs/dotfiles/         empty, filled by the trainer
 * </pre>
 *
 * Materialising the same tuple twice yields the same directory with the same
 * content, so a resumed sweep can call this blindly.
 */
@Component
public class ExperimentMaterializer {

    private static final Logger log = LoggerFactory.getLogger(ExperimentMaterializer.class);

    static final String TIME_MAX_TRAINING = "timeMaxTraining";
    static final String NB_GENERATIONS    = "nbGenerations";
    static final String NB_THREADS        = "nbThreads";

    private final SweepLayout     layout;
    private final ConfigDocuments configs;

    public ExperimentMaterializer(SweepLayout layout, ConfigDocuments configs) {
        this.layout  = layout;
        this.configs = configs;
    }

    /**
     * Fail fast before any unit is built: without a base template there is
     * nothing to copy into any unit.
     *
     * @throws MaterializationException if the template trainParams.json is missing
     */
    public void checkTemplate(MaterializationContext ctx) {
        Path template = ctx.templateDir().resolve(layout.trainParamsFile());
        if (!Files.isRegularFile(template)) {
            throw new MaterializationException(MaterializationException.Kind.TEMPLATE_MISSING,
                    "Base template not found: " + template);
        }
    }

    /** Build the unit without touching the disk: id and work directory only. */
    public ExperimentUnit plan(ParameterTuple tuple, MaterializationContext ctx) {
        String id = ExperimentIds.of(tuple);
        return new ExperimentUnit(id, layout.unitDir(ctx.sweepRoot(), id), tuple);
    }

    /**
     * Create the unit's directory tree and write its configs.
     *
     * @throws MaterializationException if the base template is missing or a
     *         config cannot be read or written
     */
    public void materialize(ExperimentUnit unit, MaterializationContext ctx) {
        Path unitDir = unit.getWorkDir();
        log.info("Materialising unit {} in {}", unit.getId(), unitDir);
        try {
            Files.createDirectories(layout.paramsDir(unitDir));
            Files.createDirectories(layout.dotfilesDir(unitDir));
            copyTemplates(unitDir, ctx);
            writeTrainParams(unit, ctx);
            writeResourceParams(unitDir, ctx);
        } catch (IOException | UncheckedIOException e) {
            throw new MaterializationException(MaterializationException.Kind.IO_ERROR,
                    "Cannot materialise unit " + unit.getId() + ": " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new MaterializationException(MaterializationException.Kind.MALFORMED_CONFIG,
                    "Cannot materialise unit " + unit.getId() + ": " + e.getMessage(), e);
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void copyTemplates(Path unitDir, MaterializationContext ctx) throws IOException {
        Path trainTemplate = ctx.templateDir().resolve(layout.trainParamsFile());
        if (!Files.isRegularFile(trainTemplate)) {
            throw new MaterializationException(MaterializationException.Kind.TEMPLATE_MISSING,
                    "Base template not found: " + trainTemplate);
        }
        Files.copy(trainTemplate, layout.trainParams(unitDir), StandardCopyOption.REPLACE_EXISTING);

        Path local = ctx.localParams();
        Path resourceTemplate = local != null && Files.isRegularFile(local)
                ? local
                : ctx.templateDir().resolve(layout.resourceParamsFile());
        if (Files.isRegularFile(resourceTemplate)) {
            Files.copy(resourceTemplate, layout.resourceParams(unitDir), StandardCopyOption.REPLACE_EXISTING);
            log.debug("Copied resource config from {}", resourceTemplate);
        }
    }

    private void writeTrainParams(ExperimentUnit unit, MaterializationContext ctx) {
        Path file = layout.trainParams(unit.getWorkDir());
        ConfigDocument doc = configs.read(file);

        doc.put(TIME_MAX_TRAINING, ctx.trainingTime().toSeconds());
        if (ctx.stopMode() == StopMode.GENERATIONS) {
            doc.put(NB_GENERATIONS, ctx.nbGenerations());
        }

        ParameterTuple tuple = unit.getTuple();
        for (Map.Entry<String, Object> field : tuple.identityFields().entrySet()) {
            if (!doc.overrideExisting(field.getKey(), field.getValue())) {
                log.warn("Key '{}' not found in {} of unit {}, left unset",
                        field.getKey(), layout.trainParamsFile(), unit.getId());
            }
        }
        // Decoration only: always recorded so the aggregator can label rows.
        doc.put(ParameterTuple.INSTRUCTION_SET_NAME, tuple.instructionSetName());

        configs.write(doc, file);
    }

    private void writeResourceParams(Path unitDir, MaterializationContext ctx) {
        Path file = layout.resourceParams(unitDir);
        if (!Files.isRegularFile(file)) {
            log.info("No {} found for {}, thread count not set", layout.resourceParamsFile(), unitDir);
            return;
        }
        ConfigDocument doc = configs.read(file);
        doc.put(NB_THREADS, ctx.trainingCores());
        configs.write(doc, file);
    }
}
