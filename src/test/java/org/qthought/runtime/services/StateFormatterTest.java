package org.qthought.runtime.services;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.qthought.runtime.model.RegisterDeclaration;
import org.qthought.runtime.model.RegisterLayout;
import org.qthought.runtime.model.RegisterRole;
import org.qthought.runtime.model.StateVector;
import org.qthought.runtime.ops.Gates;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class StateFormatterTest {

    @Test
    void printsNonZeroTermsWithRegisterBits() {
        StateVector state = new StateVector(new RegisterLayout(List.of(
                new RegisterDeclaration("s", RegisterRole.PLAIN, 1),
                new RegisterDeclaration("q", RegisterRole.PLAIN, 2))), 1e-9);
        state.applyUnitary(Gates.xorMask(2, 2), "q");
        state.applyUnitary(Gates.Z, "s");

        assertThat(new StateFormatter(3).format(state)).isEqualTo("(+1.000+0.000i)|10>|0>\n     [q, s]");
    }

    @Test
    void omitsZeroTermsOfSuperpositions() {
        StateVector state = new StateVector(new RegisterLayout(List.of(
                new RegisterDeclaration("s", RegisterRole.PLAIN, 1))), 1e-9);
        state.applyUnitary(Gates.X, "s");
        state.applyUnitary(Gates.H, "s");

        assertThat(new StateFormatter(2).format(state)).isEqualTo("(-0.71+0.00i)|1> + (+0.71+0.00i)|0>\n     [s]");
    }
}
