package com.tpgsweep.orchestrator.patch;

import com.tpgsweep.orchestrator.layout.GeneratedFile;
import com.tpgsweep.orchestrator.layout.SweepLayout;
import com.tpgsweep.orchestrator.materialize.ConfigDocuments;
import com.tpgsweep.orchestrator.model.DataType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CodePatchEngineTest {

    static final String GRAPH_SOURCE = """
            #include <math.h>
            #include "codeGenArmlearn.h"

            int bestProgram(double *results, int nb) {
                int bestProgram = 0;
                double bestScore = (isnan(results[0]))? -INFINITY : results[0];
                for (int i = 1; i < nb; i++) {
                    double challengerScore = (isnan(results[i]))? -INFINITY : results[i];
                    if (challengerScore >= bestScore) {
                        bestProgram = i;
                        bestScore = challengerScore;
                    }
                }
                return bestProgram;
            }

            void inferenceTPG(double* actions) {
                double T0Scores[2];
                double T12Scores[3];
            }
            """;

    static final String GRAPH_HEADER = """
            #ifndef C_CODEGENARMLEARN_H
            #define C_CODEGENARMLEARN_H

            void inferenceTPG(double* actions);

            #endif
            """;

    static final String PROGRAM_SOURCE = """
            #include "codeGenArmlearn_program.h"
            extern double* in1;
            extern double* in2;
            double P0() {
                double reg = in1[0] * 2.0;
                return reg; /* doubled */
            }
            """;

    static final String PROGRAM_HEADER = """
            double P0();
            double P12();
            """;

    @TempDir Path unitDir;

    SweepLayout     layout = SweepLayout.standard();
    CodePatchEngine engine;

    @BeforeEach
    void setUp() throws IOException {
        engine = new CodePatchEngine(layout, new ConfigDocuments());
        Files.createDirectories(layout.paramsDir(unitDir));
        Files.createDirectories(layout.codegenDir(unitDir));
    }

    void trainedWith(String type) throws IOException {
        Files.writeString(layout.trainParams(unitDir), """
                {
                    // patched copy of the template
                    "seed": 0,
                    "instrType": "%s"
                }
                """.formatted(type));
    }

    void generated(GeneratedFile kind, String content) throws IOException {
        Files.writeString(layout.generatedFile(unitDir, kind), content);
    }

    void generatedAll() throws IOException {
        generated(GeneratedFile.GRAPH_SOURCE, GRAPH_SOURCE);
        generated(GeneratedFile.GRAPH_HEADER, GRAPH_HEADER);
        generated(GeneratedFile.PROGRAM_SOURCE, PROGRAM_SOURCE);
        generated(GeneratedFile.PROGRAM_HEADER, PROGRAM_HEADER);
    }

    String read(GeneratedFile kind) throws IOException {
        return Files.readString(layout.generatedFile(unitDir, kind));
    }

    // ------------------------------------------------------------------
    // Graph source
    // ------------------------------------------------------------------

    @Test
    void patch_int_dropsNanSentinelAndRetypesDeclarations() throws IOException {
        trainedWith("int");
        generatedAll();

        PatchReport report = engine.patch(unitDir);

        String graph = read(GeneratedFile.GRAPH_SOURCE);
        assertThat(report.target()).isEqualTo(DataType.INT);
        assertThat(graph)
                .contains("int bestProgram(int *results, int nb)")
                .contains("int bestScore = results[0];")
                .contains("int challengerScore = results[i];")
                .contains("void inferenceTPG(int* actions) {")
                .contains("int T0Scores[2];", "int T12Scores[3];")
                .doesNotContain("isnan", "INFINITY", "double");
    }

    @Test
    void patch_float_keepsNanSentinel() throws IOException {
        trainedWith("float");
        generatedAll();

        engine.patch(unitDir);

        assertThat(read(GeneratedFile.GRAPH_SOURCE))
                .contains("float bestScore = (isnan(results[0]))? -INFINITY : results[0];")
                .contains("float challengerScore = (isnan(results[i]))? -INFINITY : results[i];")
                .doesNotContain("double");
    }

    @Test
    void patch_fixedpt_keepsNanSentinel() throws IOException {
        trainedWith("fixedpt");
        generatedAll();

        engine.patch(unitDir);

        assertThat(read(GeneratedFile.GRAPH_SOURCE))
                .contains("fixedpt bestScore = (isnan(results[0]))? -INFINITY : results[0];");
    }

    // ------------------------------------------------------------------
    // Headers and program bodies
    // ------------------------------------------------------------------

    @Test
    void patch_graphHeader_getsRetypedAndWrappedInLinkageGuard() throws IOException {
        trainedWith("float");
        generatedAll();

        engine.patch(unitDir);

        assertThat(read(GeneratedFile.GRAPH_HEADER)).isEqualTo("""
                #ifndef C_CODEGENARMLEARN_H
                #define C_CODEGENARMLEARN_H

                #ifdef __cplusplus
                extern "C" {
                #endif

                void inferenceTPG(float* actions);

                #ifdef __cplusplus
                }
                #endif

                #endif
                """);
    }

    @Test
    void patch_programSource_retypesTokensAndRemovesExternInputs() throws IOException {
        trainedWith("float");
        generatedAll();

        engine.patch(unitDir);

        assertThat(read(GeneratedFile.PROGRAM_SOURCE)).isEqualTo("""
                #include "codeGenArmlearn_program.h"
                float P0() {
                    float reg = in1[0] * 2.0;
                    return reg; /* doubled */
                }
                """);
        assertThat(read(GeneratedFile.PROGRAM_HEADER)).isEqualTo("float P0();\nfloat P12();\n");
    }

    // ------------------------------------------------------------------
    // Idempotency and partial output
    // ------------------------------------------------------------------

    @Test
    void patch_secondRun_leavesFilesByteIdentical() throws IOException {
        trainedWith("int");
        generatedAll();

        PatchReport first = engine.patch(unitDir);
        String graph  = read(GeneratedFile.GRAPH_SOURCE);
        String header = read(GeneratedFile.GRAPH_HEADER);
        String program = read(GeneratedFile.PROGRAM_SOURCE);

        PatchReport second = engine.patch(unitDir);

        assertThat(first.changedAnything()).isTrue();
        assertThat(second.changedAnything()).isFalse();
        assertThat(second.unchanged()).hasSize(4);
        assertThat(read(GeneratedFile.GRAPH_SOURCE)).isEqualTo(graph);
        assertThat(read(GeneratedFile.GRAPH_HEADER)).isEqualTo(header);
        assertThat(read(GeneratedFile.PROGRAM_SOURCE)).isEqualTo(program);
        assertThat(header.split("extern \"C\"", -1)).hasSize(2);
    }

    @Test
    void patch_missingFiles_areReportedAndSkipped() throws IOException {
        trainedWith("float");
        generated(GeneratedFile.GRAPH_SOURCE, GRAPH_SOURCE);

        PatchReport report = engine.patch(unitDir);

        assertThat(report.missing()).containsExactly(
                GeneratedFile.GRAPH_HEADER, GeneratedFile.PROGRAM_SOURCE, GeneratedFile.PROGRAM_HEADER);
        assertThat(report.appliedRules()).containsKey(GeneratedFile.GRAPH_SOURCE);
    }

    @Test
    void patch_doubleTarget_onlyAddsGuardAndDropsExterns() throws IOException {
        trainedWith("double");
        generatedAll();

        PatchReport report = engine.patch(unitDir);

        assertThat(report.appliedRules()).containsOnlyKeys(GeneratedFile.GRAPH_HEADER, GeneratedFile.PROGRAM_SOURCE);
        assertThat(report.appliedRules().get(GeneratedFile.GRAPH_HEADER)).containsExactly("linkage-guard");
        assertThat(report.appliedRules().get(GeneratedFile.PROGRAM_SOURCE)).containsExactly("extern-inputs");
        assertThat(read(GeneratedFile.GRAPH_SOURCE)).isEqualTo(GRAPH_SOURCE);
    }

    // ------------------------------------------------------------------
    // Config errors
    // ------------------------------------------------------------------

    @Test
    void patch_unknownType_throwsUnknownType() throws IOException {
        trainedWith("bfloat16");
        generatedAll();

        assertThatThrownBy(() -> engine.patch(unitDir))
                .isInstanceOf(PatchException.class)
                .satisfies(e -> assertThat(((PatchException) e).getKind()).isEqualTo(PatchException.Kind.UNKNOWN_TYPE));
        assertThat(read(GeneratedFile.GRAPH_SOURCE)).isEqualTo(GRAPH_SOURCE);
    }

    @Test
    void patch_missingConfig_throwsConfigMissing() {
        assertThatThrownBy(() -> engine.patch(unitDir))
                .isInstanceOf(PatchException.class)
                .hasMessageStartingWith("[CONFIG_MISSING]");
    }

    @Test
    void patch_configWithoutType_throwsConfigMissing() throws IOException {
        Files.writeString(layout.trainParams(unitDir), "{ \"seed\": 1 }");

        assertThatThrownBy(() -> engine.patch(unitDir))
                .isInstanceOf(PatchException.class)
                .hasMessageContaining("instrType")
                .satisfies(e -> assertThat(((PatchException) e).getKind()).isEqualTo(PatchException.Kind.CONFIG_MISSING));
    }
}
