package org.qthought.runtime.model;

import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.qthought.runtime.api.DimensionException;
import org.qthought.runtime.api.NotCollapsedException;
import org.qthought.runtime.internal.services.SeededRandomProvider;
import org.qthought.runtime.ops.Gates;
import org.qthought.runtime.ops.Operation;
import org.qthought.runtime.spi.IRandomProvider;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@Tag("unit")
class StateVectorTest {

    private static final double EPS = 1e-12;

    private StateVector state;

    @BeforeEach
    void setUp() {
        RegisterLayout layout = new RegisterLayout(List.of(
                new RegisterDeclaration("a", RegisterRole.PLAIN, 1),
                new RegisterDeclaration("b", RegisterRole.PLAIN, 2),
                new RegisterDeclaration("m", RegisterRole.MEMORY, 2)));
        state = new StateVector(layout, 1e-9);
    }

    @Test
    void startsInAllZeroBasisState() {
        assertThat(state.size()).isEqualTo(32);
        assertThat(state.amplitude(0)).isEqualTo(Complex.ONE);
        assertThat(state.readout("a")).isZero();
        assertThat(state.readout("b")).isZero();
        assertThat(state.norm()).isCloseTo(1.0, within(EPS));
    }

    @Test
    void hadamardCreatesEqualSuperposition() {
        state.applyUnitary(Gates.H, "a");

        assertThat(state.probabilities("a")).containsExactly(new double[]{0.5, 0.5}, within(EPS));
        assertThat(state.support("a")).containsExactly(0, 1);
        assertThat(state.support("b")).containsExactly(0);
    }

    @Test
    void firstTargetOccupiesLowBitsOfOperation() {
        // b = 1 (low bit of b set), then add b into m
        state.applyUnitary(Gates.xorMask(2, 1), "b");
        state.applyUnitary(Gates.add(2, 2), "b", "m");

        assertThat(state.readout("m")).isEqualTo(1);
        assertThat(state.readout("b")).isEqualTo(1);
    }

    @Test
    void controlledUnitaryOnlyActsWhereControlIsSet() {
        state.applyUnitary(Gates.H, "a");
        state.applyUnitary(Gates.xorMask(2, 3), List.of("b"), List.of("a"));

        assertThat(state.projectTo("a", 0).state().readout("b")).isZero();
        assertThat(state.projectTo("a", 1).state().readout("b")).isEqualTo(3);
    }

    @Test
    void normIsPreservedAcrossOperationsAndMeasurements() {
        IRandomProvider random = new SeededRandomProvider(7L);
        Operation[] gates = {Gates.H, Gates.Y, Gates.S, Gates.ry(0.3), Gates.Z};
        for (int i = 0; i < 50; i++) {
            state.applyUnitary(gates[i % gates.length], "a");
            state.applyUnitary(Gates.add(1, 2), List.of("a", "m"), List.of());
            state.applyUnitary(Gates.ry(0.1 * i), List.of("a"), List.of("b"));
            if (i % 10 == 9) {
                state.measure("m", random);
            }
            assertThat(state.norm()).isCloseTo(1.0, within(1e-9));
        }
    }

    @Test
    void measureCollapsesOntoSampledOutcome() {
        IRandomProvider random = mock(IRandomProvider.class);
        when(random.nextDouble()).thenReturn(0.75);
        state.applyUnitary(Gates.H, "a");
        state.applyUnitary(Gates.add(1, 2), "a", "m");

        int outcome = state.measure("a", random);

        assertThat(outcome).isEqualTo(1);
        assertThat(state.readout("a")).isEqualTo(1);
        assertThat(state.readout("m")).isEqualTo(1);
        assertThat(state.norm()).isCloseTo(1.0, within(EPS));
    }

    @Test
    void projectToLeavesReceiverUntouched() {
        state.applyUnitary(Gates.H, "a");

        Branch branch = state.projectTo("a", 1);

        assertThat(branch.isReachable()).isTrue();
        assertThat(branch.probability()).isCloseTo(0.5, within(EPS));
        assertThat(branch.state().readout("a")).isEqualTo(1);
        assertThat(state.support("a")).containsExactly(0, 1);
    }

    @Test
    void projectionOntoZeroAmplitudeIsUnreachable() {
        Branch branch = state.projectTo("b", 2);

        assertThat(branch.isReachable()).isFalse();
        assertThat(branch.state()).isNull();
        assertThat(state.branches("b")).hasSize(1);
    }

    @Test
    void branchProbabilitiesSumToOne() {
        state.applyUnitary(Gates.ry(1.0), "a");
        List<Branch> branches = state.branches("a");

        assertThat(branches).hasSize(2);
        assertThat(branches.get(0).probability() + branches.get(1).probability()).isCloseTo(1.0, within(EPS));
    }

    @Test
    void readoutOfSuperposedRegisterFails() {
        state.applyUnitary(Gates.H, "a");

        assertThatThrownBy(() -> state.readout("a")).isInstanceOf(NotCollapsedException.class);
    }

    @Test
    void rejectsWidthMismatchAndOverlap() {
        assertThatThrownBy(() -> state.applyUnitary(Gates.H, "b")).isInstanceOf(DimensionException.class);
        assertThatThrownBy(() -> state.applyUnitary(Gates.add(1, 1), "a", "a")).isInstanceOf(DimensionException.class);
        assertThatThrownBy(() -> state.applyUnitary(Gates.H, List.of("a"), List.of("a")))
                .isInstanceOf(DimensionException.class);
        assertThatThrownBy(() -> state.applyUnitary(Gates.H, "unknown")).isInstanceOf(DimensionException.class);
    }

    @Test
    void setAmplitudesRenormalizesAndResetRestoresZeroState() {
        Complex[] amplitudes = new Complex[state.size()];
        Arrays.fill(amplitudes, Complex.ZERO);
        amplitudes[0] = new Complex(3.0);
        amplitudes[1] = new Complex(0.0, 4.0);

        state.setAmplitudes(amplitudes);

        assertThat(state.amplitude(0).getReal()).isCloseTo(0.6, within(EPS));
        assertThat(state.amplitude(1).getImaginary()).isCloseTo(0.8, within(EPS));
        assertThat(state.norm()).isCloseTo(1.0, within(EPS));

        state.reset();
        assertThat(state.amplitude(0)).isEqualTo(Complex.ONE);
        assertThat(state.isNonZero(1)).isFalse();
    }

    @Test
    void setAmplitudesRejectsWrongLengthAndZeroVector() {
        assertThatThrownBy(() -> state.setAmplitudes(new Complex[]{Complex.ONE}))
                .isInstanceOf(DimensionException.class);
        Complex[] zeros = new Complex[state.size()];
        Arrays.fill(zeros, Complex.ZERO);
        assertThatThrownBy(() -> state.setAmplitudes(zeros)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void copyIsIndependent() {
        StateVector copy = state.copy();
        copy.applyUnitary(Gates.X, "a");

        assertThat(state.readout("a")).isZero();
        assertThat(copy.readout("a")).isEqualTo(1);
    }
}
