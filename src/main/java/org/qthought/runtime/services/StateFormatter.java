package org.qthought.runtime.services;

import org.qthought.runtime.model.Register;
import org.qthought.runtime.model.RegisterLayout;
import org.qthought.runtime.model.StateVector;

import java.util.List;
import java.util.Locale;

/**
 * Renders the basis state decomposition of a state vector for diagnostics, e.g.
 * <pre>
 * (+0.71+0.00i)|1>|1> + (+0.71+0.00i)|0>|0>
 *      [Bob_memory, s]
 * </pre>
 * Registers are printed most significant first; terms below the tolerance are omitted.
 */
public final class StateFormatter {

    private final int precision;

    /**
     * @param precision decimals printed per amplitude component.
     */
    public StateFormatter(int precision) {
        if (precision < 0) {
            throw new IllegalArgumentException("Precision must not be negative, got " + precision);
        }
        this.precision = precision;
    }

    /**
     * @param state the state to render.
     * @return the decomposition followed by the register legend.
     */
    public String format(StateVector state) {
        RegisterLayout layout = state.layout();
        List<Register> registers = layout.registers();
        String number = "%+." + precision + "f";
        StringBuilder sb = new StringBuilder();
        for (int i = state.size() - 1; i >= 0; i--) {
            if (!state.isNonZero(i)) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(" + ");
            }
            sb.append('(')
                    .append(String.format(Locale.ROOT, number, rounded(state.amplitude(i).getReal())))
                    .append(String.format(Locale.ROOT, number, rounded(state.amplitude(i).getImaginary())))
                    .append("i)");
            for (int r = registers.size() - 1; r >= 0; r--) {
                Register register = registers.get(r);
                sb.append('|').append(bits(register.valueOf(i), register.width())).append('>');
            }
        }
        sb.append("\n     [");
        for (int r = registers.size() - 1; r >= 0; r--) {
            sb.append(registers.get(r).name());
            if (r > 0) {
                sb.append(", ");
            }
        }
        return sb.append(']').toString();
    }

    // keeps "-0.00" out of the dump
    private double rounded(double component) {
        return Math.abs(component) < 0.5 * Math.pow(10, -precision) ? 0.0 : component;
    }

    private static String bits(int value, int width) {
        StringBuilder sb = new StringBuilder(width);
        for (int bit = width - 1; bit >= 0; bit--) {
            sb.append((value >>> bit) & 1);
        }
        return sb.toString();
    }
}
