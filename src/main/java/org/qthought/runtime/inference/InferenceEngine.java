package org.qthought.runtime.inference;

import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import org.qthought.runtime.QuantumSystem;
import org.qthought.runtime.RuntimeSettings;
import org.qthought.runtime.agent.InferenceTable;
import org.qthought.runtime.agent.Observation;
import org.qthought.runtime.model.Register;
import org.qthought.runtime.model.RegisterLayout;
import org.qthought.runtime.protocol.Protocol;
import org.qthought.runtime.spi.IInterpretation;
import org.qthought.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Derives inference tables by conditioning on each value of a source register and recording
 * the values a target register can take later (forward) or could have had earlier (backward).
 * <p>
 * Every derivation runs on freshly allocated systems whose agents carry no inference tables.
 * Measurement steps branch on all reachable outcomes instead of sampling, so results do not
 * depend on randomness. With {@code inference.parallelism > 1} the source values are explored on
 * a fixed worker pool owned by the engine; {@link #close()} releases it.
 */
public final class InferenceEngine implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(InferenceEngine.class);

    private final IInterpretation interpretation;
    private final RuntimeSettings settings;
    private final ExecutorService executor;

    /**
     * @param interpretation the interpretation to reason in.
     */
    public InferenceEngine(IInterpretation interpretation) {
        this(interpretation, RuntimeSettings.defaults());
    }

    /**
     * @param interpretation the interpretation to reason in.
     * @param settings engine settings; {@code inferenceParallelism} sizes the worker pool.
     */
    public InferenceEngine(IInterpretation interpretation, RuntimeSettings settings) {
        this.interpretation = Objects.requireNonNull(interpretation, "interpretation");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.executor = settings.inferenceParallelism() > 1
                ? Executors.newFixedThreadPool(settings.inferenceParallelism())
                : null;
    }

    /**
     * For each value {@code v} of {@code source} at {@code sourceTime}, the set of values of
     * {@code target} that remain possible at {@code targetTime} on the branch where the source
     * held {@code v}. Values whose branch has zero amplitude are listed as unreachable.
     *
     * @param protocol the protocol.
     * @param source the observed register.
     * @param sourceTime a step time of the protocol.
     * @param target the predicted register.
     * @param targetTime a step time of the protocol, not before {@code sourceTime}.
     * @return the forward table.
     * @throws IllegalArgumentException if a time is not a step time or the times are out of order.
     * @throws org.qthought.runtime.api.DimensionException if a register is unknown.
     */
    public InferenceTable forwardInference(Protocol protocol, String source, int sourceTime,
                                           String target, int targetTime) {
        checkTime(protocol, sourceTime);
        checkTime(protocol, targetTime);
        if (sourceTime > targetTime) {
            throw new IllegalArgumentException("Forward inference needs sourceTime <= targetTime, got "
                    + sourceTime + " > " + targetTime);
        }
        IRandomProvider random = settings.newRandomProvider().deriveFor("inference", 0);
        QuantumSystem system = QuantumSystem.allocate(protocol.getRequirements(), interpretation, settings, random);
        Register sourceRegister = system.layout().register(source);
        system.layout().register(target);

        LOG.debug("Forward inference {}@{} -> {}@{}", source, sourceTime, target, targetTime);
        BranchTree prefix = BranchTree.root(system).runUntil(protocol, sourceTime);

        List<Callable<IntSortedSet>> tasks = new ArrayList<>(sourceRegister.valueCount());
        for (int value = 0; value < sourceRegister.valueCount(); value++) {
            final int v = value;
            tasks.add(() -> explore(protocol, prefix, source, v, sourceTime, target, targetTime, random));
        }
        List<IntSortedSet> supports = invokeAll(tasks);

        InferenceTable.Builder table = InferenceTable.builder(source, sourceTime, target, targetTime);
        for (int value = 0; value < supports.size(); value++) {
            if (supports.get(value) == null) {
                table.markUnreachable(value);
            } else {
                table.putAll(value, supports.get(value));
            }
        }
        InferenceTable result = table.build();
        LOG.debug("Forward inference result:\n{}", result);
        return result;
    }

    /**
     * For each value {@code v} that {@code source} can hold at {@code sourceTime}, the set of
     * values {@code target} could have held at the earlier {@code targetTime}. Derived from the
     * forward table {@code target@targetTime -> source@sourceTime} by inversion; source values
     * that never occur are listed as unreachable.
     *
     * @param protocol the protocol.
     * @param source the observed register.
     * @param sourceTime a step time of the protocol.
     * @param target the retrodicted register.
     * @param targetTime a step time of the protocol, not after {@code sourceTime}.
     * @return the backward table.
     * @throws IllegalArgumentException if a time is not a step time or the times are out of order.
     */
    public InferenceTable backwardInference(Protocol protocol, String source, int sourceTime,
                                            String target, int targetTime) {
        if (targetTime > sourceTime) {
            throw new IllegalArgumentException("Backward inference needs targetTime <= sourceTime, got "
                    + targetTime + " > " + sourceTime);
        }
        InferenceTable forward = forwardInference(protocol, target, targetTime, source, sourceTime);
        InferenceTable.Builder table = InferenceTable.builder(new Observation(source, sourceTime),
                new Observation(target, targetTime));
        for (Int2ObjectMap.Entry<IntSortedSet> entry : forward.entries().int2ObjectEntrySet()) {
            for (int sourceValue : entry.getValue()) {
                table.put(sourceValue, entry.getIntKey());
            }
        }
        InferenceTable inverted = table.build();
        int sourceValues = new RegisterLayout(protocol.getRequirements().registerDeclarations())
                .register(source).valueCount();
        for (int value = 0; value < sourceValues; value++) {
            if (!inverted.containsKey(value)) {
                table.markUnreachable(value);
            }
        }
        InferenceTable result = table.build();
        LOG.debug("Backward inference result:\n{}", result);
        return result;
    }

    private static IntSortedSet explore(Protocol protocol, BranchTree prefix, String source, int value,
                                        int sourceTime, String target, int targetTime, IRandomProvider random) {
        BranchTree projected = prefix.project(source, value);
        if (projected.isEmpty()) {
            LOG.debug("{}={} is unreachable at t{}", source, value, sourceTime);
            return null;
        }
        projected.reseed(random.deriveFor(source, value));
        IntSortedSet support = projected.runBetween(protocol, sourceTime, targetTime).support(target);
        LOG.debug("{}={} -> {} in {}", source, value, target, support);
        return support;
    }

    private List<IntSortedSet> invokeAll(List<Callable<IntSortedSet>> tasks) {
        List<IntSortedSet> results = new ArrayList<>(tasks.size());
        if (executor == null) {
            for (Callable<IntSortedSet> task : tasks) {
                try {
                    results.add(task.call());
                } catch (RuntimeException e) {
                    throw e;
                } catch (Exception e) {
                    throw new IllegalStateException("Inference branch failed", e);
                }
            }
            return results;
        }
        try {
            for (Future<IntSortedSet> future : executor.invokeAll(tasks)) {
                results.add(future.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while exploring inference branches", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new IllegalStateException("Inference branch failed", e.getCause());
        }
        return results;
    }

    private static void checkTime(Protocol protocol, int time) {
        if (!protocol.times().contains(time)) {
            throw new IllegalArgumentException("Time " + time + " is not a step time of the protocol, known times: "
                    + protocol.times());
        }
    }

    @Override
    public void close() {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warn("Inference workers did not stop in time, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
