package org.qthought.runtime.ops;

import org.apache.commons.math3.complex.Complex;
import org.qthought.runtime.Config;
import org.qthought.runtime.api.DimensionException;

import java.util.Objects;

/**
 * A unitary given as a dense complex matrix. Construction validates the shape and unitarity.
 */
public final class MatrixOperation implements Operation {

    private final String name;
    private final int arity;
    private final double[][] re;
    private final double[][] im;

    /**
     * Creates an operation from a complex matrix.
     * @param name the operation name.
     * @param matrix a square unitary matrix of dimension {@code 2^k}.
     * @throws DimensionException if the matrix is not square or its dimension is not a power of two.
     * @throws IllegalArgumentException if the matrix is not unitary within the default tolerance.
     */
    public MatrixOperation(String name, Complex[][] matrix) {
        this.name = Objects.requireNonNull(name, "name");
        int dim = matrix.length;
        this.arity = arityOf(dim);
        this.re = new double[dim][dim];
        this.im = new double[dim][dim];
        for (int row = 0; row < dim; row++) {
            if (matrix[row].length != dim) {
                throw new DimensionException("Matrix of " + name + " is not square");
            }
            for (int col = 0; col < dim; col++) {
                re[row][col] = matrix[row][col].getReal();
                im[row][col] = matrix[row][col].getImaginary();
            }
        }
        checkUnitary();
    }

    private MatrixOperation(String name, int arity, double[][] re, double[][] im) {
        this.name = name;
        this.arity = arity;
        this.re = re;
        this.im = im;
    }

    /**
     * Creates an operation from a real matrix.
     * @param name the operation name.
     * @param matrix a square real orthogonal matrix of dimension {@code 2^k}.
     * @return the operation.
     */
    public static MatrixOperation real(String name, double[][] matrix) {
        Complex[][] complex = new Complex[matrix.length][];
        for (int row = 0; row < matrix.length; row++) {
            complex[row] = new Complex[matrix[row].length];
            for (int col = 0; col < matrix[row].length; col++) {
                complex[row][col] = new Complex(matrix[row][col]);
            }
        }
        return new MatrixOperation(name, complex);
    }

    private static int arityOf(int dim) {
        if (dim < 2 || Integer.bitCount(dim) != 1) {
            throw new DimensionException("Matrix dimension must be a power of two >= 2, got " + dim);
        }
        return Integer.numberOfTrailingZeros(dim);
    }

    private void checkUnitary() {
        int dim = re.length;
        for (int i = 0; i < dim; i++) {
            for (int j = 0; j < dim; j++) {
                // (M^dagger M)_ij = sum_k conj(M_ki) * M_kj
                double sumRe = 0.0;
                double sumIm = 0.0;
                for (int k = 0; k < dim; k++) {
                    sumRe += re[k][i] * re[k][j] + im[k][i] * im[k][j];
                    sumIm += re[k][i] * im[k][j] - im[k][i] * re[k][j];
                }
                double expected = i == j ? 1.0 : 0.0;
                if (Math.abs(sumRe - expected) > Config.DEFAULT_TOLERANCE * dim || Math.abs(sumIm) > Config.DEFAULT_TOLERANCE * dim) {
                    throw new IllegalArgumentException("Matrix of " + name + " is not unitary");
                }
            }
        }
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public int arity() {
        return arity;
    }

    @Override
    public void apply(double[] inRe, double[] inIm, double[] outRe, double[] outIm) {
        int dim = re.length;
        for (int row = 0; row < dim; row++) {
            double accRe = 0.0;
            double accIm = 0.0;
            double[] rowRe = re[row];
            double[] rowIm = im[row];
            for (int col = 0; col < dim; col++) {
                accRe += rowRe[col] * inRe[col] - rowIm[col] * inIm[col];
                accIm += rowRe[col] * inIm[col] + rowIm[col] * inRe[col];
            }
            outRe[row] = accRe;
            outIm[row] = accIm;
        }
    }

    @Override
    public Operation adjoint() {
        int dim = re.length;
        double[][] adjRe = new double[dim][dim];
        double[][] adjIm = new double[dim][dim];
        for (int row = 0; row < dim; row++) {
            for (int col = 0; col < dim; col++) {
                adjRe[col][row] = re[row][col];
                adjIm[col][row] = -im[row][col];
            }
        }
        return new MatrixOperation(name + "^dagger", arity, adjRe, adjIm);
    }

    /**
     * @param row row index.
     * @param col column index.
     * @return the matrix entry.
     */
    public Complex entry(int row, int col) {
        return new Complex(re[row][col], im[row][col]);
    }

    @Override
    public String toString() {
        return name + "[" + arity + " bit" + (arity == 1 ? "" : "s") + "]";
    }
}
