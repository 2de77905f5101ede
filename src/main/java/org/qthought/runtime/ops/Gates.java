package org.qthought.runtime.ops;

import org.apache.commons.math3.complex.Complex;

/**
 * Standard single-qubit gates and the reversible arithmetic used by observations and inferences.
 */
public final class Gates {

    private static final double SQRT_HALF = Math.sqrt(0.5);

    /** Hadamard. */
    public static final Operation H = MatrixOperation.real("H", new double[][]{
            {SQRT_HALF, SQRT_HALF},
            {SQRT_HALF, -SQRT_HALF}});

    /** Pauli X (bit flip). */
    public static final Operation X = xorMask("X", 1, 1);

    /** Pauli Y. */
    public static final Operation Y = new MatrixOperation("Y", new Complex[][]{
            {Complex.ZERO, Complex.I.negate()},
            {Complex.I, Complex.ZERO}});

    /** Pauli Z (phase flip). */
    public static final Operation Z = MatrixOperation.real("Z", new double[][]{
            {1, 0},
            {0, -1}});

    /** Phase gate. */
    public static final Operation S = new MatrixOperation("S", new Complex[][]{
            {Complex.ONE, Complex.ZERO},
            {Complex.ZERO, Complex.I}});

    private Gates() {}

    /**
     * Rotation about the Y axis.
     * @param theta rotation angle in radians.
     * @return {@code [[cos(t/2), -sin(t/2)], [sin(t/2), cos(t/2)]]}.
     */
    public static Operation ry(double theta) {
        double c = Math.cos(theta / 2);
        double s = Math.sin(theta / 2);
        return MatrixOperation.real("Ry(" + theta + ")", new double[][]{
                {c, -s},
                {s, c}});
    }

    /**
     * Flips the bits selected by {@code mask} on a register of the given width.
     * @param width the register width.
     * @param mask the bits to flip.
     * @return the operation, which is its own inverse.
     */
    public static Operation xorMask(int width, int mask) {
        return xorMask("XOR(" + mask + ")", width, mask);
    }

    private static Operation xorMask(String name, int width, int mask) {
        if (mask < 0 || mask >= (1 << width)) {
            throw new IllegalArgumentException("Mask " + mask + " does not fit into " + width + " bits");
        }
        return new PermutationOperation(name, width, i -> i ^ mask);
    }

    /**
     * Modular adder acting on a source register followed by a target register:
     * {@code (a, b) -> (a, a + b mod 2^targetWidth)}. Its adjoint is the subtractor.
     *
     * @param sourceWidth width of the added register (low bits of the local index).
     * @param targetWidth width of the accumulating register (high bits of the local index).
     * @return the adder.
     */
    public static Operation add(int sourceWidth, int targetWidth) {
        int sourceMask = (1 << sourceWidth) - 1;
        int targetMask = (1 << targetWidth) - 1;
        return new PermutationOperation("Add", sourceWidth + targetWidth, i -> {
            int a = i & sourceMask;
            int b = (i >>> sourceWidth) & targetMask;
            int sum = (a + b) & targetMask;
            return a | (sum << sourceWidth);
        });
    }
}
