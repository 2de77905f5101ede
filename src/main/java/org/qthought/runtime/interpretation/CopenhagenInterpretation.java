package org.qthought.runtime.interpretation;

import org.qthought.runtime.Config;
import org.qthought.runtime.agent.Agent;
import org.qthought.runtime.api.DimensionException;
import org.qthought.runtime.model.Register;
import org.qthought.runtime.ops.Gates;
import org.qthought.runtime.ops.Operation;
import org.qthought.runtime.ops.PermutationOperation;
import org.qthought.runtime.requirements.RequirementKind;
import org.qthought.runtime.spi.IInterpretation;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Standard unitary quantum mechanics with observations modelled as coherent copies.
 * <p>
 * An observation adds the observed value into the observer's memory modulo {@code 2^width}; on a
 * fresh all-zero memory this is a CNOT-style copy. An inference XORs the agent's resolved
 * prediction into its prediction register, a classical permutation conditioned on the memory.
 */
public final class CopenhagenInterpretation implements IInterpretation {

    public static final String NAME = "copenhagen";

    private static final Set<RequirementKind.Type> SUPPORTED =
            Collections.unmodifiableSet(EnumSet.allOf(RequirementKind.Type.class));

    private final double tolerance;

    public CopenhagenInterpretation() {
        this(Config.DEFAULT_TOLERANCE);
    }

    /**
     * @param tolerance the amplitude tolerance, must be positive.
     */
    public CopenhagenInterpretation(double tolerance) {
        if (tolerance <= 0.0) {
            throw new IllegalArgumentException("Tolerance must be positive, got " + tolerance);
        }
        this.tolerance = tolerance;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Set<RequirementKind.Type> supportedKinds() {
        return SUPPORTED;
    }

    @Override
    public Operation observeUnitary(Register memory, Register source) {
        if (memory.width() < source.width()) {
            throw new DimensionException("Memory '" + memory.name() + "' (" + memory.width()
                    + " bits) is too small to observe '" + source.name() + "' (" + source.width() + " bits)");
        }
        return Gates.add(source.width(), memory.width());
    }

    @Override
    public Operation inferenceUnitary(Agent agent) {
        int memoryWidth = agent.memory().width();
        int memoryMask = (1 << memoryWidth) - 1;
        int sentinel = agent.noPredictionValue();
        return new PermutationOperation("Inference_" + agent.getName(),
                memoryWidth + agent.prediction().width(), i -> {
                    int m = i & memoryMask;
                    int p = i >>> memoryWidth;
                    return m | ((p ^ sentinel ^ agent.predictionFor(m)) << memoryWidth);
                });
    }

    @Override
    public double tolerance() {
        return tolerance;
    }

    @Override
    public String toString() {
        return "CopenhagenInterpretation{tolerance=" + tolerance + "}";
    }
}
