package org.qthought.runtime.api;

/**
 * Thrown when an operation is applied to registers that do not exist, or whose combined width does
 * not match the arity of the operation.
 */
public class DimensionException extends QuantumProtocolException {

    /**
     * Creates a new DimensionException.
     * @param message description of the mismatch.
     */
    public DimensionException(String message) {
        super(message);
    }
}
