package org.qthought.runtime.model;

import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import org.apache.commons.math3.complex.Complex;
import org.qthought.runtime.api.DimensionException;
import org.qthought.runtime.api.NotCollapsedException;
import org.qthought.runtime.ops.Operation;
import org.qthought.runtime.spi.IRandomProvider;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Complex amplitude vector over all registers of a {@link RegisterLayout}.
 * <p>
 * Basis state {@code i} assigns bit {@code offset + k} of {@code i} to bit {@code k} of each
 * register. The vector starts in the all-zero basis state and is only mutated through
 * {@link #applyUnitary}, {@link #measure} and {@link #setAmplitudes}; projections return private
 * copies. After every mutation the squared amplitudes sum to one within the tolerance.
 * <p>
 * Instances are not thread-safe. Each protocol run owns its state exclusively.
 */
public final class StateVector {

    private final RegisterLayout layout;
    private final double tolerance;
    private final double[] re;
    private final double[] im;

    /**
     * Allocates the all-zero basis state for the given layout.
     *
     * @param layout the register arena.
     * @param tolerance the amplitude tolerance below which a component counts as zero.
     */
    public StateVector(RegisterLayout layout, double tolerance) {
        this.layout = Objects.requireNonNull(layout, "layout");
        if (tolerance <= 0.0) {
            throw new IllegalArgumentException("Tolerance must be positive, got " + tolerance);
        }
        this.tolerance = tolerance;
        int size = 1 << layout.totalWidth();
        this.re = new double[size];
        this.im = new double[size];
        this.re[0] = 1.0;
    }

    private StateVector(StateVector other) {
        this.layout = other.layout;
        this.tolerance = other.tolerance;
        this.re = other.re.clone();
        this.im = other.im.clone();
    }

    /**
     * @return an independent copy of this state.
     */
    public StateVector copy() {
        return new StateVector(this);
    }

    /**
     * @return the register layout.
     */
    public RegisterLayout layout() {
        return layout;
    }

    /**
     * @return the amplitude tolerance.
     */
    public double tolerance() {
        return tolerance;
    }

    /**
     * @return the number of basis states, {@code 2^width}.
     */
    public int size() {
        return re.length;
    }

    /**
     * Applies a unitary to the concatenation of the target registers.
     *
     * @param operation the unitary.
     * @param targets target register names, the first occupying the operation's low bits.
     * @throws DimensionException if a name is unknown, a register is repeated or the widths do
     *                            not sum to the operation's arity.
     */
    public void applyUnitary(Operation operation, String... targets) {
        applyUnitary(operation, Arrays.asList(targets), Collections.emptyList());
    }

    /**
     * Applies a controlled unitary. The operation acts on the targets only on basis states where
     * every bit of every control register is 1, and as the identity elsewhere.
     *
     * @param operation the unitary.
     * @param targets target register names, the first occupying the operation's low bits.
     * @param controls control register names, may be empty.
     * @throws DimensionException if a name is unknown, a register appears twice, targets and
     *                            controls overlap, or the target widths do not match the arity.
     */
    public void applyUnitary(Operation operation, List<String> targets, List<String> controls) {
        Objects.requireNonNull(operation, "operation");
        if (targets.isEmpty()) {
            throw new DimensionException("Operation " + operation.getName() + " needs at least one target register");
        }
        int[] targetBits = new int[operation.arity()];
        int targetMask = 0;
        int position = 0;
        for (String name : targets) {
            Register register = layout.register(name);
            if ((targetMask & register.mask()) != 0) {
                throw new DimensionException("Register '" + name + "' is targeted twice by " + operation.getName());
            }
            if (position + register.width() > targetBits.length) {
                throw new DimensionException("Operation " + operation.getName() + " acts on " + operation.arity()
                        + " bits but the targets " + targets + " are wider");
            }
            for (int bit = 0; bit < register.width(); bit++) {
                targetBits[position++] = register.offset() + bit;
            }
            targetMask |= register.mask();
        }
        if (position != targetBits.length) {
            throw new DimensionException("Operation " + operation.getName() + " acts on " + operation.arity()
                    + " bits but the targets " + targets + " have " + position);
        }
        int controlMask = 0;
        for (String name : controls) {
            Register register = layout.register(name);
            if (((targetMask | controlMask) & register.mask()) != 0) {
                throw new DimensionException("Control register '" + name + "' overlaps a target or another control");
            }
            controlMask |= register.mask();
        }

        int dim = operation.dimension();
        int[] scatter = new int[dim];
        for (int local = 0; local < dim; local++) {
            int offset = 0;
            for (int bit = 0; bit < targetBits.length; bit++) {
                if ((local & (1 << bit)) != 0) {
                    offset |= 1 << targetBits[bit];
                }
            }
            scatter[local] = offset;
        }
        double[] inRe = new double[dim];
        double[] inIm = new double[dim];
        double[] outRe = new double[dim];
        double[] outIm = new double[dim];
        for (int base = 0; base < re.length; base++) {
            if ((base & targetMask) != 0 || (base & controlMask) != controlMask) {
                continue;
            }
            for (int local = 0; local < dim; local++) {
                inRe[local] = re[base | scatter[local]];
                inIm[local] = im[base | scatter[local]];
            }
            operation.apply(inRe, inIm, outRe, outIm);
            for (int local = 0; local < dim; local++) {
                re[base | scatter[local]] = outRe[local];
                im[base | scatter[local]] = outIm[local];
            }
        }
    }

    /**
     * Computes the outcome distribution of a register in the computational basis.
     * @param registerName the register.
     * @return an array indexed by register value holding the outcome probabilities.
     */
    public double[] probabilities(String registerName) {
        Register register = layout.register(registerName);
        double[] probabilities = new double[register.valueCount()];
        for (int i = 0; i < re.length; i++) {
            probabilities[register.valueOf(i)] += re[i] * re[i] + im[i] * im[i];
        }
        return probabilities;
    }

    /**
     * Returns every value of the register whose subspace carries an amplitude above the tolerance.
     * @param registerName the register.
     * @return the possible values in ascending order.
     */
    public IntSortedSet support(String registerName) {
        Register register = layout.register(registerName);
        IntSortedSet values = new IntRBTreeSet();
        for (int i = 0; i < re.length; i++) {
            if (magnitude(i) > tolerance) {
                values.add(register.valueOf(i));
            }
        }
        return values;
    }

    /**
     * Samples a measurement outcome with the Born rule, collapses onto it and renormalizes.
     *
     * @param registerName the measured register.
     * @param random the source of randomness.
     * @return the sampled value.
     */
    public int measure(String registerName, IRandomProvider random) {
        Register register = layout.register(registerName);
        double[] probabilities = probabilities(registerName);
        double r = random.nextDouble();
        double cumulative = 0.0;
        int outcome = -1;
        for (int value = 0; value < probabilities.length; value++) {
            if (probabilities[value] <= tolerance * tolerance) {
                continue;
            }
            outcome = value;
            cumulative += probabilities[value];
            if (r < cumulative) {
                break;
            }
        }
        if (outcome < 0) {
            throw new IllegalStateException("State has no weight on register '" + registerName + "'");
        }
        collapse(register, outcome, Math.sqrt(probabilities[outcome]));
        return outcome;
    }

    /**
     * Projects a copy of this state onto one value of a register without sampling.
     * The receiver is left untouched.
     *
     * @param registerName the register.
     * @param value the classical value to project onto.
     * @return the branch, unreachable if the projected norm is below the tolerance.
     */
    public Branch projectTo(String registerName, int value) {
        Register register = layout.register(registerName);
        if (value < 0 || value >= register.valueCount()) {
            throw new DimensionException("Value " + value + " does not fit register '" + registerName
                    + "' of width " + register.width());
        }
        double weight = 0.0;
        for (int i = 0; i < re.length; i++) {
            if (register.valueOf(i) == value) {
                weight += re[i] * re[i] + im[i] * im[i];
            }
        }
        double norm = Math.sqrt(weight);
        if (norm < tolerance) {
            return Branch.unreachable(registerName, value, weight);
        }
        StateVector projected = copy();
        projected.collapse(register, value, norm);
        return new Branch(registerName, value, weight, projected);
    }

    /**
     * Splits this state into every reachable branch of a register.
     * @param registerName the register.
     * @return reachable branches in ascending value order; probabilities sum to one.
     */
    public List<Branch> branches(String registerName) {
        Register register = layout.register(registerName);
        List<Branch> branches = new ArrayList<>();
        for (int value = 0; value < register.valueCount(); value++) {
            Branch branch = projectTo(registerName, value);
            if (branch.isReachable()) {
                branches.add(branch);
            }
        }
        return branches;
    }

    /**
     * Reads the classical value of a register in a definite state.
     * @param registerName the register.
     * @return its value.
     * @throws NotCollapsedException if more than one value is possible.
     */
    public int readout(String registerName) {
        IntSortedSet values = support(registerName);
        if (values.size() != 1) {
            throw new NotCollapsedException("Register '" + registerName + "' is not in a definite state, possible values "
                    + values + ". Measure it first.");
        }
        return values.firstInt();
    }

    /**
     * @return the Euclidean norm of the amplitude vector.
     */
    public double norm() {
        double sum = 0.0;
        for (int i = 0; i < re.length; i++) {
            sum += re[i] * re[i] + im[i] * im[i];
        }
        return Math.sqrt(sum);
    }

    /**
     * @param basisIndex a basis state index.
     * @return the amplitude of that basis state.
     */
    public Complex amplitude(int basisIndex) {
        return new Complex(re[basisIndex], im[basisIndex]);
    }

    /**
     * @return a copy of all amplitudes indexed by basis state.
     */
    public Complex[] amplitudes() {
        Complex[] result = new Complex[re.length];
        for (int i = 0; i < re.length; i++) {
            result[i] = new Complex(re[i], im[i]);
        }
        return result;
    }

    /**
     * Replaces the state with custom amplitudes, renormalized to unit norm.
     * @param amplitudes one amplitude per basis state, including zeros.
     * @throws DimensionException if the array does not cover every basis state.
     * @throws IllegalArgumentException if the vector has zero norm.
     */
    public void setAmplitudes(Complex[] amplitudes) {
        if (amplitudes.length != re.length) {
            throw new DimensionException("Expected " + re.length + " amplitudes, got " + amplitudes.length);
        }
        double sum = 0.0;
        for (Complex amplitude : amplitudes) {
            double abs = amplitude.abs();
            sum += abs * abs;
        }
        double norm = Math.sqrt(sum);
        if (norm < tolerance) {
            throw new IllegalArgumentException("Cannot set a state with zero norm");
        }
        for (int i = 0; i < re.length; i++) {
            re[i] = amplitudes[i].getReal() / norm;
            im[i] = amplitudes[i].getImaginary() / norm;
        }
    }

    /**
     * Returns the state to the all-zero basis state.
     */
    public void reset() {
        Arrays.fill(re, 0.0);
        Arrays.fill(im, 0.0);
        re[0] = 1.0;
    }

    /**
     * @param basisIndex a basis state index.
     * @return true if the amplitude of that basis state exceeds the tolerance.
     */
    public boolean isNonZero(int basisIndex) {
        return magnitude(basisIndex) > tolerance;
    }

    private double magnitude(int basisIndex) {
        return Math.hypot(re[basisIndex], im[basisIndex]);
    }

    private void collapse(Register register, int value, double norm) {
        for (int i = 0; i < re.length; i++) {
            if (register.valueOf(i) == value) {
                re[i] /= norm;
                im[i] /= norm;
            } else {
                re[i] = 0.0;
                im[i] = 0.0;
            }
        }
    }
}
