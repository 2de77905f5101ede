package org.qthought.runtime.inference;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.qthought.experiments.FrauchigerRennerExperiment;
import org.qthought.experiments.SimpleExperiment;
import org.qthought.runtime.RuntimeSettings;
import org.qthought.runtime.agent.InferenceTable;
import org.qthought.runtime.agent.Observation;
import org.qthought.runtime.api.DimensionException;
import org.qthought.runtime.interpretation.CopenhagenInterpretation;
import org.qthought.runtime.ops.Gates;
import org.qthought.runtime.protocol.Protocol;
import org.qthought.runtime.protocol.Step;
import org.qthought.runtime.protocol.StepAction;
import org.qthought.runtime.requirements.Requirements;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class InferenceEngineTest {

    private InferenceEngine engine;

    @BeforeEach
    void setUp() {
        engine = new InferenceEngine(new CopenhagenInterpretation());
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    void observersOfTheSameQubitAgree() {
        InferenceTable table = engine.forwardInference(SimpleExperiment.protocol(),
                SimpleExperiment.ALICE_MEMORY, SimpleExperiment.T_ALICE_OBSERVES,
                SimpleExperiment.BOB_MEMORY, SimpleExperiment.T_BOB_OBSERVES);

        assertThat(table.get(0)).containsExactly(0);
        assertThat(table.get(1)).containsExactly(1);
        assertThat(table.unreachableKeys()).isEmpty();
        assertThat(table.input()).isEqualTo(new Observation("Alice_memory", 1));
        assertThat(table.output()).isEqualTo(new Observation("Bob_memory", 2));
    }

    @Test
    void backwardInferenceRetrodictsEarlierObservation() {
        InferenceTable table = engine.backwardInference(SimpleExperiment.protocol(),
                SimpleExperiment.BOB_MEMORY, SimpleExperiment.T_BOB_OBSERVES,
                SimpleExperiment.ALICE_MEMORY, SimpleExperiment.T_ALICE_OBSERVES);

        assertThat(table.get(0)).containsExactly(0);
        assertThat(table.get(1)).containsExactly(1);
        assertThat(table.input()).isEqualTo(new Observation("Bob_memory", 2));
    }

    @Test
    void zeroAmplitudeSourceValuesAreUnreachable() {
        Requirements domain = Requirements.of("Qubit", "s")
                .merge(Requirements.of("AgentMemory(1)", "A"))
                .merge(Requirements.of("AgentMemory(1)", "B"));
        Protocol classical = Protocol.of(
                new Step(domain, "A observes s", 1, StepAction.observe("A_memory", "s")),
                new Step(domain, "B observes s", 2, StepAction.observe("B_memory", "s")));

        InferenceTable forward = engine.forwardInference(classical, "A_memory", 1, "B_memory", 2);
        InferenceTable backward = engine.backwardInference(classical, "B_memory", 2, "A_memory", 1);

        assertThat(forward.keys()).containsExactly(0);
        assertThat(forward.unreachableKeys()).containsExactly(1);
        assertThat(backward.keys()).containsExactly(0);
        assertThat(backward.unreachableKeys()).containsExactly(1);
    }

    @Test
    void measurementStepsBranchInsteadOfSampling() {
        Requirements domain = Requirements.of("Qubit", "s").merge(Requirements.of("AgentMemory(1)", "A"));
        Protocol protocol = Protocol.of(
                new Step(domain, "H on s", 0, StepAction.applyUnitary(Gates.H, "s")),
                new Step(domain, "measure s", 1, StepAction.measure("s")),
                new Step(domain, "A observes s", 2, StepAction.observe("A_memory", "s")));

        InferenceTable fromStart = engine.forwardInference(protocol, "A_memory", 0, "A_memory", 2);
        InferenceTable fromMeasurement = engine.forwardInference(protocol, "s", 1, "A_memory", 2);

        assertThat(fromStart.get(0)).containsExactly(0, 1);
        assertThat(fromStart.unreachableKeys()).containsExactly(1);
        assertThat(fromMeasurement.get(0)).containsExactly(0);
        assertThat(fromMeasurement.get(1)).containsExactly(1);
    }

    @Test
    void derivationIsDeterministic() {
        Protocol protocol = FrauchigerRennerExperiment.protocol();

        InferenceTable first = engine.forwardInference(protocol, "Alice_memory", 2, "s", 14);
        InferenceTable second = engine.forwardInference(protocol, "Alice_memory", 2, "s", 14);

        assertThat(first).isEqualTo(second);
    }

    @Test
    void parallelExplorationMatchesSequential() {
        Protocol protocol = FrauchigerRennerExperiment.protocol();
        RuntimeSettings parallel = RuntimeSettings.defaults().withInferenceParallelism(3);

        try (InferenceEngine parallelEngine = new InferenceEngine(new CopenhagenInterpretation(), parallel)) {
            assertThat(parallelEngine.backwardInference(protocol, "Ursula_memory", 9, "Bob_memory", 5))
                    .isEqualTo(engine.backwardInference(protocol, "Ursula_memory", 9, "Bob_memory", 5));
        }
    }

    @Test
    void rejectsTimesThatAreNotStepTimesOrOutOfOrder() {
        Protocol protocol = SimpleExperiment.protocol();

        assertThatThrownBy(() -> engine.forwardInference(protocol, "Alice_memory", 7, "Bob_memory", 2))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> engine.forwardInference(protocol, "Bob_memory", 2, "Alice_memory", 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> engine.backwardInference(protocol, "Alice_memory", 1, "Bob_memory", 2))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsUnknownRegisters() {
        assertThatThrownBy(() -> engine.forwardInference(SimpleExperiment.protocol(), "Carol_memory", 1, "s", 2))
                .isInstanceOf(DimensionException.class);
    }
}
