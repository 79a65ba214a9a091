package com.tpgsweep.orchestrator.layout;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SweepLayoutTest {

    SweepLayout layout = SweepLayout.standard();
    Path        unit   = Path.of("/scratch/expe/instrType-int_seed-0");

    @Test
    void unitPaths_followTrainerLayout() {
        assertThat(layout.trainParams(unit)).isEqualTo(unit.resolve("params/trainParams.json"));
        assertThat(layout.metricsFile(unit)).isEqualTo(unit.resolve("outLogs/garbage.ods"));
        assertThat(layout.dotfilesDir(unit)).isEqualTo(unit.resolve("outLogs/dotfiles"));
        assertThat(layout.generatedFile(unit, GeneratedFile.PROGRAM_HEADER))
                .isEqualTo(unit.resolve("outLogs/CodeGen/codeGenArmlearn_program.h"));
    }

    @Test
    void tpgDirOfInferenceArtifact_walksUpThreeLevels() {
        Path tpg = Path.of("/scratch/expe/training_results/tpgA");

        assertThat(layout.tpgDirOfInferenceArtifact(tpg.resolve("inference/configs/a.json"))).isEqualTo(tpg);
        assertThat(layout.tpgDirOfInferenceArtifact(tpg.resolve("inference/results/a.json"))).isEqualTo(tpg);
    }

    @Test
    void tpgDirOfInferenceArtifact_tooShallow_throws() {
        assertThatThrownBy(() -> layout.tpgDirOfInferenceArtifact(Path.of("/a.json")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void isHeader_onlyForDotHFiles() {
        assertThat(GeneratedFile.GRAPH_HEADER.isHeader()).isTrue();
        assertThat(GeneratedFile.PROGRAM_SOURCE.isHeader()).isFalse();
    }
}
