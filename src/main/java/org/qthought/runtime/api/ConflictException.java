package org.qthought.runtime.api;

/**
 * Thrown when two requirement sets declare the same name under incompatible kinds, or when two
 * declarations expand to the same register name.
 */
public class ConflictException extends QuantumProtocolException {

    /**
     * Creates a new ConflictException.
     * @param message description of the conflicting declarations.
     */
    public ConflictException(String message) {
        super(message);
    }
}
