package org.qthought.runtime.agent;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.qthought.runtime.QuantumSystem;
import org.qthought.runtime.api.DimensionException;
import org.qthought.runtime.interpretation.CopenhagenInterpretation;
import org.qthought.runtime.ops.Gates;
import org.qthought.runtime.requirements.Requirements;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class AgentTest {

    private static final int NO_PREDICTION = 2;

    private QuantumSystem system;
    private Agent ursula;
    private InferenceTable table;

    @BeforeEach
    void setUp() {
        system = QuantumSystem.allocate(
                Requirements.of("Agent(1,2)", "Ursula").merge(Requirements.of("Qubit", "s")),
                new CopenhagenInterpretation());
        ursula = system.agent("Ursula");
        table = InferenceTable.builder("Ursula_memory", 9, "s", 14)
                .put(0, 0, 1)
                .put(1, 0)
                .build();
    }

    @Test
    void resolvesSingleValuedEntriesAndFallsBackToSentinel() {
        ursula.setInferenceTable(table, NO_PREDICTION);

        assertThat(ursula.predictionFor(0)).isEqualTo(NO_PREDICTION);
        assertThat(ursula.predictionFor(1)).isZero();
        assertThat(ursula.hasInferenceTable()).isTrue();
        assertThat(ursula.inferenceTable()).contains(table);
    }

    @Test
    void missingAndContradictoryKeysResolveToSentinel() {
        InferenceTable sparse = InferenceTable.builder("Ursula_memory", 9, "s", 14).put(0).build();

        ursula.setInferenceTable(sparse, NO_PREDICTION);

        assertThat(ursula.predictionFor(0)).isEqualTo(NO_PREDICTION);
        assertThat(ursula.predictionFor(1)).isEqualTo(NO_PREDICTION);
    }

    @Test
    void validatesTableAgainstRegisterWidths() {
        InferenceTable wideKey = InferenceTable.builder("Ursula_memory", 9, "s", 14).put(2, 0).build();
        InferenceTable wideValue = InferenceTable.builder("Ursula_memory", 9, "s", 14).put(0, 4).build();
        InferenceTable otherInput = InferenceTable.builder("Bob_memory", 5, "s", 14).put(0, 0).build();

        assertThatThrownBy(() -> ursula.setInferenceTable(wideKey, NO_PREDICTION)).isInstanceOf(DimensionException.class);
        assertThatThrownBy(() -> ursula.setInferenceTable(wideValue, NO_PREDICTION)).isInstanceOf(DimensionException.class);
        assertThatThrownBy(() -> ursula.setInferenceTable(table, 4)).isInstanceOf(DimensionException.class);
        assertThatThrownBy(() -> ursula.setInferenceTable(otherInput, NO_PREDICTION))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void inferenceWithoutPreparationFails() {
        ursula.setInferenceTable(table, NO_PREDICTION);

        assertThatThrownBy(() -> system.makeInference("Ursula", false)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void inferenceWritesResolvedPredictionAndReverseRestoresSentinel() {
        ursula.setInferenceTable(table, NO_PREDICTION);
        system.prepInference("Ursula");
        assertThat(system.readout("Ursula_prediction")).isEqualTo(NO_PREDICTION);

        system.applyUnitary(Gates.X, List.of("Ursula_memory"), List.of());
        system.makeInference("Ursula", false);
        assertThat(system.readout("Ursula_prediction")).isZero();

        system.makeInference("Ursula", true);
        assertThat(system.readout("Ursula_prediction")).isEqualTo(NO_PREDICTION);
    }

    @Test
    void inferenceIsCoherentOverSuperposedMemory() {
        ursula.setInferenceTable(table, NO_PREDICTION);
        system.prepInference("Ursula");
        system.applyUnitary(Gates.H, List.of("Ursula_memory"), List.of());

        system.makeInference("Ursula", false);

        assertThat(system.support("Ursula_prediction")).containsExactly(0, NO_PREDICTION);
        assertThat(system.state().projectTo("Ursula_memory", 1).state().readout("Ursula_prediction")).isZero();
    }

    @Test
    void agentWithoutTableLeavesPredictionUntouched() {
        system.prepInference("Ursula");
        system.applyUnitary(Gates.X, List.of("Ursula_memory"), List.of());

        system.makeInference("Ursula", false);

        assertThat(system.readout("Ursula_prediction")).isZero();
        assertThat(ursula.hasInferenceTable()).isFalse();
    }

    @Test
    void observeCopiesSourceIntoMemory() {
        system.applyUnitary(Gates.X, List.of("s"), List.of());

        ursula.observe(system, "s", false);

        assertThat(system.readout("Ursula_memory")).isEqualTo(1);
    }

    @Test
    void copiesAreIndependent() {
        Agent copy = ursula.copy();
        copy.setInferenceTable(table, NO_PREDICTION);

        assertThat(ursula.hasInferenceTable()).isFalse();
        assertThat(copy.getName()).isEqualTo("Ursula");
    }
}
