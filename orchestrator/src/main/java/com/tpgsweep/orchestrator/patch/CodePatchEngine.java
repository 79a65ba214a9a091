package com.tpgsweep.orchestrator.patch;

import com.tpgsweep.orchestrator.layout.GeneratedFile;
import com.tpgsweep.orchestrator.layout.SweepLayout;
import com.tpgsweep.orchestrator.materialize.ConfigDocument;
import com.tpgsweep.orchestrator.materialize.ConfigDocuments;
import com.tpgsweep.orchestrator.model.DataType;
import com.tpgsweep.orchestrator.model.ParameterTuple;
import com.tpgsweep.orchestrator.model.UnknownDataTypeException;
import com.tpgsweep.orchestrator.patch.rules.DeclarationSiteRule;
import com.tpgsweep.orchestrator.patch.rules.ExternInputRule;
import com.tpgsweep.orchestrator.patch.rules.LinkageGuardRule;
import com.tpgsweep.orchestrator.patch.rules.SentinelIdiomRule;
import com.tpgsweep.orchestrator.patch.rules.TypeTokenRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Specialises a unit's generated inference code to the data type it was
 * trained with.
 *
 * The code generator always writes {@code double}. Each of the four
 * generated files has its own rule list; rules run in order and a file is
 * only rewritten when its content actually changed, so running the engine
 * twice leaves the files byte-identical.
 */
@Component
public class CodePatchEngine {

    private static final Logger log = LoggerFactory.getLogger(CodePatchEngine.class);

    private final SweepLayout                         layout;
    private final ConfigDocuments                     configs;
    private final Map<GeneratedFile, List<PatchRule>> rules;

    public CodePatchEngine(SweepLayout layout, ConfigDocuments configs) {
        this(layout, configs, defaultRules());
    }

    CodePatchEngine(SweepLayout layout, ConfigDocuments configs, Map<GeneratedFile, List<PatchRule>> rules) {
        this.layout  = layout;
        this.configs = configs;
        this.rules   = rules;
    }

    static Map<GeneratedFile, List<PatchRule>> defaultRules() {
        Map<GeneratedFile, List<PatchRule>> rules = new EnumMap<>(GeneratedFile.class);
        rules.put(GeneratedFile.GRAPH_SOURCE, List.of(
                DeclarationSiteRule.bestProgram(),
                DeclarationSiteRule.inferenceDefinition(),
                DeclarationSiteRule.teamScores(),
                SentinelIdiomRule.bestScore(),
                SentinelIdiomRule.challengerScore()));
        rules.put(GeneratedFile.GRAPH_HEADER, List.of(
                DeclarationSiteRule.inferenceDeclaration(),
                new LinkageGuardRule()));
        rules.put(GeneratedFile.PROGRAM_SOURCE, List.of(
                new TypeTokenRule(),
                new ExternInputRule()));
        rules.put(GeneratedFile.PROGRAM_HEADER, List.of(
                DeclarationSiteRule.programDeclarations()));
        return rules;
    }

    /**
     * Patch the generated files of the unit rooted at {@code unitDir}.
     * Files the generator did not write are skipped with a warning.
     *
     * @throws PatchException if the unit's config is missing, names no data type
     *                        or an unknown one, or a file cannot be rewritten
     */
    public PatchReport patch(Path unitDir) {
        DataType target = targetType(unitDir);
        log.info("Patching generated code of {} to {}", unitDir.getFileName(), target);

        Map<GeneratedFile, List<String>> applied = new LinkedHashMap<>();
        List<GeneratedFile> unchanged = new ArrayList<>();
        List<GeneratedFile> missing   = new ArrayList<>();

        for (Map.Entry<GeneratedFile, List<PatchRule>> entry : rules.entrySet()) {
            GeneratedFile kind = entry.getKey();
            Path file = layout.generatedFile(unitDir, kind);
            if (!Files.isRegularFile(file)) {
                log.warn("{} not found, skipping {} patch", file, kind);
                missing.add(kind);
                continue;
            }
            List<String> changedBy = patchFile(file, entry.getValue(), target);
            if (changedBy.isEmpty()) {
                unchanged.add(kind);
            } else {
                applied.put(kind, changedBy);
                log.debug("{} rewritten by {}", file.getFileName(), changedBy);
            }
        }
        return new PatchReport(unitDir, target, applied, unchanged, missing);
    }

    private List<String> patchFile(Path file, List<PatchRule> fileRules, DataType target) {
        try {
            String original = Files.readString(file);
            String content = original;
            List<String> changedBy = new ArrayList<>();
            for (PatchRule rule : fileRules) {
                String next = rule.apply(content, target);
                if (!next.equals(content)) {
                    changedBy.add(rule.name());
                    content = next;
                }
            }
            if (!content.equals(original)) {
                Files.writeString(file, content);
            }
            return changedBy;
        } catch (IOException e) {
            throw new PatchException(PatchException.Kind.IO_ERROR, "Cannot patch " + file, e);
        }
    }

    private DataType targetType(Path unitDir) {
        Path params = layout.trainParams(unitDir);
        ConfigDocument doc;
        try {
            doc = configs.read(params);
        } catch (UncheckedIOException | IllegalArgumentException e) {
            throw new PatchException(PatchException.Kind.CONFIG_MISSING,
                    "Cannot read " + params + ": " + e.getMessage(), e);
        }
        try {
            return doc.dataType().orElseThrow(() -> new PatchException(PatchException.Kind.CONFIG_MISSING,
                    params + " has no " + ParameterTuple.DATA_TYPE));
        } catch (UnknownDataTypeException e) {
            throw new PatchException(PatchException.Kind.UNKNOWN_TYPE,
                    "Unit " + unitDir.getFileName() + ": " + e.getMessage(), e);
        }
    }
}
