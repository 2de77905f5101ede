package org.qthought.runtime.api;

/**
 * Thrown when a protocol is run against a system that was not allocated with everything the
 * protocol requires, or when a step reaches outside its domain at run time.
 */
public class UnsatisfiedRequirementsException extends QuantumProtocolException {

    /**
     * Creates a new UnsatisfiedRequirementsException.
     * @param message description of the missing requirements.
     */
    public UnsatisfiedRequirementsException(String message) {
        super(message);
    }
}
