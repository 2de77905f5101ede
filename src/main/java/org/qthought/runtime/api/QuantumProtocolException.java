package org.qthought.runtime.api;

/**
 * Base class for the unchecked errors raised while declaring, allocating or running a protocol.
 * <p>
 * All subclasses signal programmer or declaration errors. They are fatal for the current run and
 * are never retried, because every operation except sampling a measurement is deterministic.
 */
public abstract class QuantumProtocolException extends RuntimeException {

    /**
     * Constructs a new exception with the specified detail message.
     * @param message The detail message.
     */
    protected QuantumProtocolException(String message) {
        super(message);
    }

    /**
     * Constructs a new exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    protected QuantumProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
