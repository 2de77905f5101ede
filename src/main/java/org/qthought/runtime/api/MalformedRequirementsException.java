package org.qthought.runtime.api;

/**
 * Thrown when a requirement declaration cannot be understood: an unparsable kind string, a
 * non-positive width, a kind the loaded interpretation does not support, or a step whose action
 * touches registers outside its declared domain.
 */
public class MalformedRequirementsException extends QuantumProtocolException {

    /**
     * Creates a new MalformedRequirementsException.
     * @param message description of the malformed declaration.
     */
    public MalformedRequirementsException(String message) {
        super(message);
    }

    /**
     * Creates a new MalformedRequirementsException with a cause.
     * @param message description of the malformed declaration.
     * @param cause the parsing failure.
     */
    public MalformedRequirementsException(String message, Throwable cause) {
        super(message, cause);
    }
}
