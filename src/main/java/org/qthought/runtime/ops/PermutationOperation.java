package org.qthought.runtime.ops;

import java.util.Objects;
import java.util.function.IntUnaryOperator;

/**
 * A unitary that permutes computational basis states, such as classical reversible arithmetic.
 * The mapping is tabulated once; its inverse is the adjoint.
 */
public final class PermutationOperation implements Operation {

    private final String name;
    private final int arity;
    private final int[] mapping;

    /**
     * Tabulates a basis permutation.
     * @param name the operation name.
     * @param arity the number of bits.
     * @param mapping maps each local basis index to its image.
     * @throws IllegalArgumentException if the mapping is not a bijection on {@code [0, 2^arity)}.
     */
    public PermutationOperation(String name, int arity, IntUnaryOperator mapping) {
        this.name = Objects.requireNonNull(name, "name");
        if (arity <= 0 || arity > 30) {
            throw new IllegalArgumentException("Arity must be in [1, 30], got " + arity);
        }
        this.arity = arity;
        int dim = 1 << arity;
        this.mapping = new int[dim];
        boolean[] hit = new boolean[dim];
        for (int i = 0; i < dim; i++) {
            int image = mapping.applyAsInt(i);
            if (image < 0 || image >= dim || hit[image]) {
                throw new IllegalArgumentException(name + " is not a permutation: index " + i + " maps to " + image);
            }
            hit[image] = true;
            this.mapping[i] = image;
        }
    }

    private PermutationOperation(String name, int arity, int[] mapping) {
        this.name = name;
        this.arity = arity;
        this.mapping = mapping;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public int arity() {
        return arity;
    }

    /**
     * @param index a local basis index.
     * @return the image of the index.
     */
    public int map(int index) {
        return mapping[index];
    }

    @Override
    public void apply(double[] inRe, double[] inIm, double[] outRe, double[] outIm) {
        for (int i = 0; i < mapping.length; i++) {
            outRe[mapping[i]] = inRe[i];
            outIm[mapping[i]] = inIm[i];
        }
    }

    @Override
    public Operation adjoint() {
        int[] inverse = new int[mapping.length];
        for (int i = 0; i < mapping.length; i++) {
            inverse[mapping[i]] = i;
        }
        return new PermutationOperation(name + "^dagger", arity, inverse);
    }

    @Override
    public String toString() {
        return name + "[" + arity + " bit" + (arity == 1 ? "" : "s") + "]";
    }
}
