package org.qthought.runtime;

/**
 * Provides centralized compile-time defaults for the qthought runtime.
 * Values that users are expected to tune are also exposed through {@link RuntimeSettings},
 * which reads them from HOCON and falls back to the constants defined here.
 * This class is not meant to be instantiated.
 */
public final class Config {

    /**
     * Private constructor to prevent instantiation of this utility class.
     */
    private Config() {}

    /**
     * Default tolerance for amplitude and norm comparisons. Absorbs round-off accumulated by
     * repeated unitary composition.
     */
    public static final double DEFAULT_TOLERANCE = 1e-9;

    /**
     * Largest total register width a system may allocate. A state over n bits holds 2^n
     * amplitudes in two double arrays.
     */
    public static final int DEFAULT_MAX_QUBITS = 24;

    /**
     * Seed used by the inference engine for systems it allocates internally.
     */
    public static final long DEFAULT_RANDOM_SEED = 42L;

    /**
     * Number of decimals printed for amplitudes in state dumps.
     */
    public static final int DEFAULT_PRINT_PRECISION = 2;

    /**
     * Suffix of the memory register created for an agent or an agent memory requirement.
     */
    public static final String MEMORY_SUFFIX = "_memory";

    /**
     * Suffix of the prediction (inference) register created for an agent.
     */
    public static final String PREDICTION_SUFFIX = "_prediction";
}
