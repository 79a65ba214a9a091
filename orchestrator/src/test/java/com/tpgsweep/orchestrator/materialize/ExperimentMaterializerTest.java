package com.tpgsweep.orchestrator.materialize;

import com.tpgsweep.orchestrator.TestFixtures;
import com.tpgsweep.orchestrator.layout.SweepLayout;
import com.tpgsweep.orchestrator.model.DataType;
import com.tpgsweep.orchestrator.model.ExperimentUnit;
import com.tpgsweep.orchestrator.model.InstructionSet;
import com.tpgsweep.orchestrator.model.ParameterTuple;
import com.tpgsweep.orchestrator.model.StopMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExperimentMaterializerTest {

    @TempDir Path tmp;

    SweepLayout            layout  = SweepLayout.standard();
    ConfigDocuments        configs = new ConfigDocuments();
    ExperimentMaterializer materializer;
    Path                   templates;
    Path                   root;

    @BeforeEach
    void setUp() throws Exception {
        materializer = new ExperimentMaterializer(layout, configs);
        templates = TestFixtures.writeTemplates(tmp.resolve("templates"));
        root = tmp.resolve("expe");
    }

    MaterializationContext context(StopMode mode) {
        return new MaterializationContext(root, templates, 4, Duration.ofMinutes(90), mode, 250, null);
    }

    ParameterTuple tuple(int seed, DataType type) {
        return new ParameterTuple(seed, TestFixtures.instructionSet("trig", true, false), type);
    }

    @Test
    void materialize_writesIdentityFieldsAndBudget() throws Exception {
        MaterializationContext ctx = context(StopMode.TIME);
        ExperimentUnit unit = materializer.plan(tuple(3, DataType.INT), ctx);

        materializer.materialize(unit, ctx);

        Path unitDir = root.resolve("instrType-int_seed-3_useInstrLogExp-False_useInstrTrig-True");
        assertThat(unit.getWorkDir()).isEqualTo(unitDir);
        assertThat(Files.isDirectory(unitDir.resolve("outLogs/dotfiles"))).isTrue();

        ConfigDocument train = configs.read(unitDir.resolve("params/trainParams.json"));
        assertThat(train.seed()).contains(3);
        assertThat(train.dataTypeTag()).contains("int");
        assertThat(train.instructionSetName()).contains("trig");
        assertThat(train.extensions())
                .containsEntry("useInstrTrig", true)
                .containsEntry("useInstrLogExp", false)
                .containsEntry("timeMaxTraining", 5400)
                .containsEntry("nbGenerations", 100);

        ConfigDocument params = configs.read(unitDir.resolve("params/params.json"));
        assertThat(params.extensions()).containsEntry("nbThreads", 4);
    }

    @Test
    void materialize_generationsMode_writesGenerationCount() {
        MaterializationContext ctx = context(StopMode.GENERATIONS);
        ExperimentUnit unit = materializer.plan(tuple(0, DataType.FLOAT), ctx);

        materializer.materialize(unit, ctx);

        ConfigDocument train = configs.read(layout.trainParams(unit.getWorkDir()));
        assertThat(train.extensions()).containsEntry("nbGenerations", 250);
    }

    @Test
    void materialize_flagMissingFromTemplate_isLeftUnsetNotFatal() {
        MaterializationContext ctx = context(StopMode.TIME);
        ParameterTuple withZmmul = new ParameterTuple(0,
                new InstructionSet("zmmul", Map.of("useInstrZmmul", true)), DataType.DOUBLE);
        ExperimentUnit unit = materializer.plan(withZmmul, ctx);

        materializer.materialize(unit, ctx);

        ConfigDocument train = configs.read(layout.trainParams(unit.getWorkDir()));
        assertThat(train.has("useInstrZmmul")).isFalse();
        assertThat(train.instructionSetName()).contains("zmmul");
    }

    @Test
    void materialize_twice_producesSameDirectoryAndContent() throws Exception {
        MaterializationContext ctx = context(StopMode.TIME);
        ExperimentUnit first = materializer.plan(tuple(1, DataType.DOUBLE), ctx);
        materializer.materialize(first, ctx);
        String once = Files.readString(layout.trainParams(first.getWorkDir()));

        ExperimentUnit second = materializer.plan(tuple(1, DataType.DOUBLE), ctx);
        materializer.materialize(second, ctx);

        assertThat(second.getWorkDir()).isEqualTo(first.getWorkDir());
        assertThat(Files.readString(layout.trainParams(second.getWorkDir()))).isEqualTo(once);
    }

    @Test
    void materialize_localParamsReplaceTemplate() throws Exception {
        Path local = tmp.resolve("local-params.json");
        Files.writeString(local, "{\"nbThreads\": 2, \"local\": true}");
        MaterializationContext ctx = new MaterializationContext(
                root, templates, 6, Duration.ofHours(1), StopMode.TIME, 10, local);
        ExperimentUnit unit = materializer.plan(tuple(0, DataType.DOUBLE), ctx);

        materializer.materialize(unit, ctx);

        ConfigDocument params = configs.read(layout.resourceParams(unit.getWorkDir()));
        assertThat(params.extensions()).containsEntry("local", true).containsEntry("nbThreads", 6);
    }

    @Test
    void checkTemplate_missingTemplate_throwsTemplateMissing() throws Exception {
        Files.delete(templates.resolve("trainParams.json"));

        assertThatThrownBy(() -> materializer.checkTemplate(context(StopMode.TIME)))
                .isInstanceOf(MaterializationException.class)
                .satisfies(e -> assertThat(((MaterializationException) e).getKind())
                        .isEqualTo(MaterializationException.Kind.TEMPLATE_MISSING));
    }

    @Test
    void materialize_malformedTemplate_throwsMalformedConfig() throws Exception {
        Files.writeString(templates.resolve("trainParams.json"), "{ not json");
        MaterializationContext ctx = context(StopMode.TIME);
        ExperimentUnit unit = materializer.plan(tuple(0, DataType.DOUBLE), ctx);

        assertThatThrownBy(() -> materializer.materialize(unit, ctx))
                .isInstanceOf(MaterializationException.class)
                .hasMessageContaining("MALFORMED_CONFIG");
    }
}
