package org.qthought.runtime.model;

/**
 * The result of projecting a state vector onto one classical value of a register.
 * An unreachable branch carries no state: its subspace had numerically zero amplitude.
 *
 * @param register    the projected register
 * @param value       the classical value projected onto
 * @param probability the squared norm of the projected component before renormalization
 * @param state       the renormalized private copy, or {@code null} when unreachable
 */
public record Branch(String register, int value, double probability, StateVector state) {

    static Branch unreachable(String register, int value, double probability) {
        return new Branch(register, value, probability, null);
    }

    /**
     * @return true if the projected component had a non-negligible norm.
     */
    public boolean isReachable() {
        return state != null;
    }
}
