package com.tpgsweep.orchestrator.layout;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Declares where every artifact of a sweep lives on disk and resolves those
 * locations by name.
 *
 * Work directories follow the layout external tools expect:
 * <pre>
 *   &lt;root&gt;/&lt;unit-id&gt;/params/trainParams.json
 *   &lt;root&gt;/&lt;unit-id&gt;/params/params.json
 *   &lt;root&gt;/&lt;unit-id&gt;/outLogs/garbage.ods
 *   &lt;root&gt;/&lt;unit-id&gt;/outLogs/CodeGen/codeGenArmlearn*.{c,h}
 * </pre>
 * Inference artifacts hang below collected TPG directories:
 * <pre>
 *   &lt;root&gt;/training_results/&lt;tpg&gt;/inference/configs/*.json
 *   &lt;root&gt;/training_results/&lt;tpg&gt;/inference/results/*.json
 * </pre>
 * Every ancestor walk is derived from these declarations, so changing the
 * layout means changing this record only.
 */
public record SweepLayout(
        String paramsDir,
        String outLogsDir,
        String dotfilesDir,
        String trainParamsFile,
        String resourceParamsFile,
        String metricsFile,
        String codegenDir,
        String graphSource,
        String graphHeader,
        String programSource,
        String programHeader,
        String trainingResultsDir,
        String inferenceDir,
        String inferenceConfigsDir,
        String inferenceResultsDir,
        String inferenceOverlaysDir) {

    public SweepLayout {
        Objects.requireNonNull(paramsDir, "paramsDir cannot be null");
        Objects.requireNonNull(outLogsDir, "outLogsDir cannot be null");
        Objects.requireNonNull(inferenceDir, "inferenceDir cannot be null");
        Objects.requireNonNull(inferenceConfigsDir, "inferenceConfigsDir cannot be null");
        Objects.requireNonNull(inferenceResultsDir, "inferenceResultsDir cannot be null");
    }

    /** The layout produced by the containerised trainer and code generator. */
    public static SweepLayout standard() {
        return new SweepLayout(
                "params", "outLogs", "dotfiles",
                "trainParams.json", "params.json", "garbage.ods",
                "CodeGen",
                "codeGenArmlearn.c", "codeGenArmlearn.h",
                "codeGenArmlearn_program.c", "codeGenArmlearn_program.h",
                "training_results",
                "inference", "configs", "results", "overlays");
    }

    // ------------------------------------------------------------------
    // Experiment unit directories
    // ------------------------------------------------------------------

    public Path unitDir(Path root, String unitId) {
        return root.resolve(unitId);
    }

    public Path paramsDir(Path unitDir)      { return unitDir.resolve(paramsDir); }
    public Path outLogsDir(Path unitDir)     { return unitDir.resolve(outLogsDir); }
    public Path dotfilesDir(Path unitDir)    { return outLogsDir(unitDir).resolve(dotfilesDir); }
    public Path trainParams(Path unitDir)    { return paramsDir(unitDir).resolve(trainParamsFile); }
    public Path resourceParams(Path unitDir) { return paramsDir(unitDir).resolve(resourceParamsFile); }
    public Path metricsFile(Path unitDir)    { return outLogsDir(unitDir).resolve(metricsFile); }
    public Path codegenDir(Path unitDir)     { return outLogsDir(unitDir).resolve(codegenDir); }

    public Path generatedFile(Path unitDir, GeneratedFile file) {
        String name = switch (file) {
            case GRAPH_SOURCE   -> graphSource;
            case GRAPH_HEADER   -> graphHeader;
            case PROGRAM_SOURCE -> programSource;
            case PROGRAM_HEADER -> programHeader;
        };
        return codegenDir(unitDir).resolve(name);
    }

    // ------------------------------------------------------------------
    // Inference directories
    // ------------------------------------------------------------------

    public Path trainingResults(Path root)           { return root.resolve(trainingResultsDir); }
    public Path inferenceDir(Path tpgDir)            { return tpgDir.resolve(inferenceDir); }
    public Path inferenceConfigsDir(Path tpgDir)     { return inferenceDir(tpgDir).resolve(inferenceConfigsDir); }
    public Path inferenceResultsDir(Path tpgDir)     { return inferenceDir(tpgDir).resolve(inferenceResultsDir); }
    public Path inferenceOverlaysDir(Path tpgDir)    { return inferenceDir(tpgDir).resolve(inferenceOverlaysDir); }

    /**
     * The TPG directory owning an inference config or result document.
     *
     * @throws IllegalArgumentException if the path is too shallow to sit in the layout
     */
    public Path tpgDirOfInferenceArtifact(Path artifact) {
        // artifact's parent is configs/ or results/, both one level below inference/.
        int levels = 1 + depth(inferenceDir) + 1;
        Path dir = artifact.toAbsolutePath().normalize();
        for (int i = 0; i < levels; i++) {
            dir = dir.getParent();
            if (dir == null) {
                throw new IllegalArgumentException(
                        "Path is not inside an inference directory: " + artifact);
            }
        }
        return dir;
    }

    private static int depth(String relative) {
        return Path.of(relative).getNameCount();
    }
}
