package org.qthought.runtime.ops;

/**
 * A unitary operation on a fixed number of bits.
 * <p>
 * The operation sees a local state vector of {@code 2^arity()} amplitudes whose index is the
 * concatenation of the target registers, the first target occupying the least significant bits.
 * The state vector gathers, transforms and scatters these local vectors for every assignment of
 * the remaining bits.
 */
public interface Operation {

    /**
     * @return a short human readable name used in diagnostics.
     */
    String getName();

    /**
     * @return the number of bits the operation acts on.
     */
    int arity();

    /**
     * @return the dimension of the local space, {@code 2^arity()}.
     */
    default int dimension() {
        return 1 << arity();
    }

    /**
     * Applies the operation to a local vector. Input and output arrays never alias.
     *
     * @param inRe  real parts of the input amplitudes
     * @param inIm  imaginary parts of the input amplitudes
     * @param outRe receives the real parts of the result
     * @param outIm receives the imaginary parts of the result
     */
    void apply(double[] inRe, double[] inIm, double[] outRe, double[] outIm);

    /**
     * @return the inverse of this operation.
     */
    Operation adjoint();
}
