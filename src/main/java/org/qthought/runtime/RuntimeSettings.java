package org.qthought.runtime;

import org.qthought.config.ConfigLoader;
import org.qthought.config.LoggingConfigurator;
import org.qthought.runtime.internal.services.SeededRandomProvider;
import org.qthought.runtime.spi.IRandomProvider;

/**
 * Engine settings read from the {@code qthought} configuration section.
 *
 * @param tolerance            amplitude tolerance below which a component counts as zero
 * @param maxQubits            largest total register width a system may allocate
 * @param randomSeed           seed of the root random provider
 * @param printPrecision       decimals printed for amplitudes in state dumps
 * @param inferenceParallelism worker threads used to explore inference branches, 1 for none
 */
public record RuntimeSettings(double tolerance, int maxQubits, long randomSeed, int printPrecision,
                              int inferenceParallelism) {

    static final String ROOT_PATH = "qthought";

    public RuntimeSettings {
        if (tolerance <= 0.0) {
            throw new IllegalArgumentException("tolerance must be positive, got " + tolerance);
        }
        if (maxQubits <= 0 || maxQubits > 30) {
            throw new IllegalArgumentException("max-qubits must be in [1, 30], got " + maxQubits);
        }
        if (printPrecision < 0) {
            throw new IllegalArgumentException("print-precision must not be negative, got " + printPrecision);
        }
        if (inferenceParallelism <= 0) {
            throw new IllegalArgumentException("inference.parallelism must be positive, got " + inferenceParallelism);
        }
    }

    /**
     * @return the built-in defaults, matching {@code reference.conf}.
     */
    public static RuntimeSettings defaults() {
        return new RuntimeSettings(Config.DEFAULT_TOLERANCE, Config.DEFAULT_MAX_QUBITS, Config.DEFAULT_RANDOM_SEED,
                Config.DEFAULT_PRINT_PRECISION, 1);
    }

    /**
     * Reads settings from a configuration that contains a {@code qthought} section.
     * Missing keys fall back to {@link #defaults()}.
     *
     * @param config the resolved configuration.
     * @return the settings.
     */
    public static RuntimeSettings fromConfig(com.typesafe.config.Config config) {
        RuntimeSettings defaults = defaults();
        if (!config.hasPath(ROOT_PATH)) {
            return defaults;
        }
        com.typesafe.config.Config section = config.getConfig(ROOT_PATH);
        return new RuntimeSettings(
                section.hasPath("tolerance") ? section.getDouble("tolerance") : defaults.tolerance(),
                section.hasPath("max-qubits") ? section.getInt("max-qubits") : defaults.maxQubits(),
                section.hasPath("random-seed") ? section.getLong("random-seed") : defaults.randomSeed(),
                section.hasPath("print-precision") ? section.getInt("print-precision") : defaults.printPrecision(),
                section.hasPath("inference.parallelism")
                        ? section.getInt("inference.parallelism") : defaults.inferenceParallelism());
    }

    /**
     * Loads the layered configuration, applies its logging section and reads the settings.
     *
     * @return the settings.
     */
    public static RuntimeSettings load() {
        com.typesafe.config.Config config = ConfigLoader.load();
        LoggingConfigurator.configure(config);
        return fromConfig(config);
    }

    /**
     * @return a new root random provider seeded with {@link #randomSeed()}.
     */
    public IRandomProvider newRandomProvider() {
        return new SeededRandomProvider(randomSeed);
    }

    /**
     * @param tolerance the new amplitude tolerance.
     * @return a copy of these settings with another tolerance.
     */
    public RuntimeSettings withTolerance(double tolerance) {
        return new RuntimeSettings(tolerance, maxQubits, randomSeed, printPrecision, inferenceParallelism);
    }

    /**
     * @param seed the new seed.
     * @return a copy of these settings with another seed.
     */
    public RuntimeSettings withRandomSeed(long seed) {
        return new RuntimeSettings(tolerance, maxQubits, seed, printPrecision, inferenceParallelism);
    }

    /**
     * @param parallelism the new worker count.
     * @return a copy of these settings with another inference parallelism.
     */
    public RuntimeSettings withInferenceParallelism(int parallelism) {
        return new RuntimeSettings(tolerance, maxQubits, randomSeed, printPrecision, parallelism);
    }
}
