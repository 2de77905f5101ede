package org.qthought.runtime.spi;

import org.qthought.runtime.agent.Agent;
import org.qthought.runtime.model.Register;
import org.qthought.runtime.ops.Operation;
import org.qthought.runtime.requirements.RequirementKind;

import java.util.Set;

/**
 * Capability object describing how an interpretation of quantum mechanics realizes observations
 * and inferences as unitaries.
 * <p>
 * The runtime never depends on a concrete interpretation; one is passed into allocation and into
 * the inference engine, and a process may hold several for comparative runs.
 */
public interface IInterpretation {

    /**
     * @return a short identifier, e.g. {@code "copenhagen"}.
     */
    String getName();

    /**
     * @return the requirement kinds this interpretation can allocate.
     */
    Set<RequirementKind.Type> supportedKinds();

    /**
     * Returns the unitary that copies the classical information of {@code source} into
     * {@code memory}. The operation acts on the concatenation (source, memory), source in the low
     * bits.
     *
     * @param memory the observer's memory register.
     * @param source the observed register.
     * @return the observation unitary.
     */
    Operation observeUnitary(Register memory, Register source);

    /**
     * Returns the inverse of {@link #observeUnitary}, used to undo an observation.
     *
     * @param memory the observer's memory register.
     * @param source the observed register.
     * @return the adjoint observation unitary.
     */
    default Operation observeAdjoint(Register memory, Register source) {
        return observeUnitary(memory, source).adjoint();
    }

    /**
     * Returns the agent's inference circuit for its currently loaded table. The operation acts on
     * the concatenation (memory, prediction), memory in the low bits.
     *
     * @param agent the reasoning agent.
     * @return the inference unitary.
     */
    Operation inferenceUnitary(Agent agent);

    /**
     * @return the tolerance for amplitude and norm comparisons.
     */
    double tolerance();
}
