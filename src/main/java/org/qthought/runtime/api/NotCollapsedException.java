package org.qthought.runtime.api;

/**
 * Thrown when a classical readout is requested for a register that is still in superposition.
 * The caller has to measure the register first.
 */
public class NotCollapsedException extends QuantumProtocolException {

    /**
     * Creates a new NotCollapsedException.
     * @param message description of the register and its possible values.
     */
    public NotCollapsedException(String message) {
        super(message);
    }
}
