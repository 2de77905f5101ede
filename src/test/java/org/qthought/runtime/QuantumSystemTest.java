package org.qthought.runtime;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.qthought.runtime.api.DimensionException;
import org.qthought.runtime.api.MalformedRequirementsException;
import org.qthought.runtime.api.NotCollapsedException;
import org.qthought.runtime.api.UnsatisfiedRequirementsException;
import org.qthought.runtime.interpretation.CopenhagenInterpretation;
import org.qthought.runtime.ops.Gates;
import org.qthought.runtime.requirements.RequirementKind;
import org.qthought.runtime.requirements.Requirements;
import org.qthought.runtime.spi.IInterpretation;
import org.qthought.runtime.spi.IRandomProvider;

import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@Tag("unit")
class QuantumSystemTest {

    private final IInterpretation copenhagen = new CopenhagenInterpretation();

    private QuantumSystem superposedQubitWithObserver() {
        QuantumSystem system = QuantumSystem.allocate(
                Requirements.of("Qubit", "s").merge(Requirements.of("AgentMemory(1)", "Alice")), copenhagen);
        system.applyUnitary(Gates.H, List.of("s"), List.of());
        return system;
    }

    @Test
    void allocatesRegistersAndAgents() {
        QuantumSystem system = QuantumSystem.allocate(
                Requirements.of("Agent(2,1)", "Bob").merge(Requirements.of("Qureg(3)", "q")), copenhagen);

        assertThat(system.layout().totalWidth()).isEqualTo(6);
        assertThat(system.state().size()).isEqualTo(64);
        assertThat(system.agents()).containsOnlyKeys("Bob");
        assertThat(system.agent("Bob").memory().width()).isEqualTo(2);
        assertThat(system.agent("Bob").prediction().name()).isEqualTo("Bob_prediction");
        assertThat(system.readout("q")).isZero();
    }

    @Test
    void observationEntanglesMemoryWithSource() {
        QuantumSystem system = superposedQubitWithObserver();

        system.observe("Alice_memory", "s", false);

        assertThat(system.support("Alice_memory")).containsExactly(0, 1);
        assertThatThrownBy(() -> system.readout("Alice_memory")).isInstanceOf(NotCollapsedException.class);
        int outcome = system.measure("s");
        assertThat(system.readout("Alice_memory")).isEqualTo(outcome);
    }

    @Test
    void reverseObservationRestoresPreviousState() {
        QuantumSystem system = superposedQubitWithObserver();

        system.observe("Alice_memory", "s", false);
        system.observe("Alice_memory", "s", true);

        assertThat(system.readout("Alice_memory")).isZero();
        assertThat(system.state().probabilities("s")[1]).isCloseTo(0.5, within(1e-12));
    }

    @Test
    void observationNeedsMemoryAtLeastAsWideAsSource() {
        QuantumSystem system = QuantumSystem.allocate(
                Requirements.of("Qureg(2)", "q").merge(Requirements.of("AgentMemory(1)", "Alice")), copenhagen);

        assertThatThrownBy(() -> system.observe("Alice_memory", "q", false)).isInstanceOf(DimensionException.class);
    }

    @Test
    void measurementUsesTheSystemRandomProvider() {
        QuantumSystem system = superposedQubitWithObserver();
        IRandomProvider random = mock(IRandomProvider.class);
        when(random.nextDouble()).thenReturn(0.9);
        system.setRandomProvider(random);

        assertThat(system.measure("s")).isEqualTo(1);
        assertThat(system.readout("s")).isEqualTo(1);
    }

    @Test
    void enforcesQubitLimit() {
        RuntimeSettings small = new RuntimeSettings(1e-9, 3, 42L, 2, 1);

        assertThatThrownBy(() -> QuantumSystem.allocate(Requirements.of("Qureg(4)", "q"), copenhagen, small))
                .isInstanceOf(DimensionException.class)
                .hasMessageContaining("limit");
    }

    @Test
    void rejectsUnknownAgentsAndUnsupportedKinds() {
        QuantumSystem system = superposedQubitWithObserver();
        assertThatThrownBy(() -> system.agent("Alice")).isInstanceOf(UnsatisfiedRequirementsException.class);

        IInterpretation limited = mock(IInterpretation.class);
        when(limited.getName()).thenReturn("limited");
        when(limited.supportedKinds()).thenReturn(EnumSet.of(RequirementKind.Type.QUBIT));
        when(limited.tolerance()).thenReturn(1e-9);
        assertThatThrownBy(() -> QuantumSystem.allocate(Requirements.of("Agent(1,1)", "A"), limited))
                .isInstanceOf(MalformedRequirementsException.class);
    }

    @Test
    void stateToleranceComesFromSettings() {
        RuntimeSettings settings = new RuntimeSettings(1e-3, 24, 42L, 2, 1);

        QuantumSystem configured = QuantumSystem.allocate(Requirements.of("Qubit", "s"), copenhagen, settings);
        QuantumSystem byInterpretation = QuantumSystem.allocate(Requirements.of("Qubit", "s"),
                new CopenhagenInterpretation(1e-6));

        assertThat(configured.state().tolerance()).isEqualTo(1e-3);
        assertThat(byInterpretation.state().tolerance()).isEqualTo(1e-6);
    }

    @Test
    void copyIsDeep() {
        QuantumSystem system = QuantumSystem.allocate(Requirements.of("Agent(1,1)", "A"), copenhagen);
        QuantumSystem copy = system.copy();

        copy.applyUnitary(Gates.X, List.of("A_memory"), List.of());

        assertThat(system.readout("A_memory")).isZero();
        assertThat(copy.readout("A_memory")).isEqualTo(1);
        assertThat(copy.agent("A")).isNotSameAs(system.agent("A"));
    }

    @Test
    void dumpListsBasisStatesMostSignificantRegisterFirst() {
        QuantumSystem system = superposedQubitWithObserver();
        system.observe("Alice_memory", "s", false);

        assertThat(system.toString())
                .contains("(+0.71+0.00i)|1>|1>")
                .contains("(+0.71+0.00i)|0>|0>")
                .endsWith("[Alice_memory, s]");
    }
}
