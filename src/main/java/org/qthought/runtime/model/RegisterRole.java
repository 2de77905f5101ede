package org.qthought.runtime.model;

/**
 * The role a register plays inside a quantum system.
 */
public enum RegisterRole {
    /** A plain binary subsystem (qubit or qubit register) that is not owned by an observer. */
    PLAIN,
    /** The memory of an observer, written by observations. */
    MEMORY,
    /** The prediction register of an observer, written by its inference circuit. */
    PREDICTION
}
