package org.qthought.runtime;

import it.unimi.dsi.fastutil.ints.IntSortedSet;
import org.qthought.runtime.agent.Agent;
import org.qthought.runtime.api.DimensionException;
import org.qthought.runtime.api.UnsatisfiedRequirementsException;
import org.qthought.runtime.model.Branch;
import org.qthought.runtime.model.Register;
import org.qthought.runtime.model.RegisterLayout;
import org.qthought.runtime.model.StateVector;
import org.qthought.runtime.ops.Operation;
import org.qthought.runtime.requirements.RequirementKind;
import org.qthought.runtime.requirements.Requirements;
import org.qthought.runtime.services.StateFormatter;
import org.qthought.runtime.spi.IInterpretation;
import org.qthought.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A state vector together with its registers, the agents created for {@code Agent} requirements,
 * the interpretation that realizes observations and inferences, and the random provider used for
 * measurements.
 * <p>
 * Systems are created by {@link #allocate}. A system is owned by one protocol run at a time and
 * is not thread-safe; {@link #copy()} produces a fully independent system for branching.
 */
public final class QuantumSystem {

    private static final Logger LOG = LoggerFactory.getLogger(QuantumSystem.class);

    private final Requirements requirements;
    private final IInterpretation interpretation;
    private final StateVector state;
    private final Map<String, Agent> agents;
    private final int printPrecision;
    private IRandomProvider random;

    private QuantumSystem(Requirements requirements, IInterpretation interpretation, StateVector state,
                          Map<String, Agent> agents, IRandomProvider random, int printPrecision) {
        this.requirements = requirements;
        this.interpretation = interpretation;
        this.state = state;
        this.agents = agents;
        this.random = random;
        this.printPrecision = printPrecision;
    }

    /**
     * Allocates a system with the default settings and the interpretation's tolerance.
     *
     * @param requirements the resources to allocate.
     * @param interpretation the interpretation to realize them with.
     * @return the system in the all-zero basis state.
     */
    public static QuantumSystem allocate(Requirements requirements, IInterpretation interpretation) {
        return allocate(requirements, interpretation,
                RuntimeSettings.defaults().withTolerance(interpretation.tolerance()));
    }

    /**
     * Allocates a system with a random provider seeded from the settings.
     *
     * @param requirements the resources to allocate.
     * @param interpretation the interpretation to realize them with.
     * @param settings engine settings.
     * @return the system in the all-zero basis state.
     */
    public static QuantumSystem allocate(Requirements requirements, IInterpretation interpretation,
                                         RuntimeSettings settings) {
        return allocate(requirements, interpretation, settings, settings.newRandomProvider());
    }

    /**
     * Allocates one register per declared resource, in the ledger's storage order, and one
     * {@link Agent} per {@code Agent(n,m)} name.
     *
     * @param requirements the resources to allocate.
     * @param interpretation the interpretation to realize them with.
     * @param settings engine settings; {@link RuntimeSettings#tolerance()} becomes the state's tolerance.
     * @param random the random provider used by {@link #measure}.
     * @return the system in the all-zero basis state.
     * @throws org.qthought.runtime.api.MalformedRequirementsException if the interpretation
     *         does not support a kind.
     * @throws DimensionException if the total width exceeds {@link RuntimeSettings#maxQubits()}.
     */
    public static QuantumSystem allocate(Requirements requirements, IInterpretation interpretation,
                                         RuntimeSettings settings, IRandomProvider random) {
        Objects.requireNonNull(requirements, "requirements");
        Objects.requireNonNull(interpretation, "interpretation");
        Objects.requireNonNull(random, "random");
        requirements.validate(interpretation);
        RegisterLayout layout = new RegisterLayout(requirements.registerDeclarations());
        if (layout.totalWidth() > settings.maxQubits()) {
            throw new DimensionException("Requirements need " + layout.totalWidth() + " qubits, the limit is "
                    + settings.maxQubits());
        }
        Map<String, Agent> agents = new LinkedHashMap<>();
        for (RequirementKind kind : requirements.kinds()) {
            if (kind.type() != RequirementKind.Type.AGENT) {
                continue;
            }
            for (String name : requirements.names(kind)) {
                agents.put(name, new Agent(name, layout.register(name + Config.MEMORY_SUFFIX),
                        layout.register(name + Config.PREDICTION_SUFFIX)));
            }
        }
        LOG.debug("Allocated {} registers ({} qubits) and {} agents under '{}'", layout.registers().size(),
                layout.totalWidth(), agents.size(), interpretation.getName());
        return new QuantumSystem(requirements, interpretation, new StateVector(layout, settings.tolerance()),
                agents, random, settings.printPrecision());
    }

    public Requirements requirements() {
        return requirements;
    }

    public IInterpretation interpretation() {
        return interpretation;
    }

    public StateVector state() {
        return state;
    }

    public RegisterLayout layout() {
        return state.layout();
    }

    public IRandomProvider randomProvider() {
        return random;
    }

    /**
     * Replaces the provider used by {@link #measure}, e.g. with a per-trial derived stream.
     * @param random the new provider.
     */
    public void setRandomProvider(IRandomProvider random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * @param name the agent name.
     * @return the agent.
     * @throws UnsatisfiedRequirementsException if no {@code Agent} of that name was allocated.
     */
    public Agent agent(String name) {
        Agent agent = agents.get(name);
        if (agent == null) {
            throw new UnsatisfiedRequirementsException("System has no agent '" + name + "', known agents: "
                    + agents.keySet());
        }
        return agent;
    }

    /**
     * @return the agents by name, in allocation order.
     */
    public Map<String, Agent> agents() {
        return Collections.unmodifiableMap(agents);
    }

    /**
     * @see StateVector#applyUnitary(Operation, List, List)
     */
    public void applyUnitary(Operation operation, List<String> targets, List<String> controls) {
        state.applyUnitary(operation, targets, controls);
    }

    /**
     * Lets a memory register record the value of a source register, or undoes that record.
     *
     * @param memoryRegister the observer's memory.
     * @param sourceRegister the observed register.
     * @param reverse whether to undo a previous observation.
     * @throws DimensionException if the memory is narrower than the source.
     */
    public void observe(String memoryRegister, String sourceRegister, boolean reverse) {
        Register memory = layout().register(memoryRegister);
        Register source = layout().register(sourceRegister);
        Operation operation = reverse
                ? interpretation.observeAdjoint(memory, source)
                : interpretation.observeUnitary(memory, source);
        state.applyUnitary(operation, List.of(sourceRegister, memoryRegister), List.of());
    }

    /**
     * @param agentName the agent.
     * @see Agent#prepInference
     */
    public void prepInference(String agentName) {
        agent(agentName).prepInference(state);
    }

    /**
     * @param agentName the agent.
     * @param reverse whether to undo a previous inference.
     * @see Agent#makeInference
     */
    public void makeInference(String agentName, boolean reverse) {
        agent(agentName).makeInference(state, interpretation, reverse);
    }

    /**
     * Measures a register in the computational basis and collapses the state.
     * @param register the register.
     * @return the observed value.
     */
    public int measure(String register) {
        int outcome = state.measure(register, random);
        LOG.debug("Measured {} = {}", register, outcome);
        return outcome;
    }

    /**
     * @see StateVector#readout(String)
     */
    public int readout(String register) {
        return state.readout(register);
    }

    /**
     * @see StateVector#support(String)
     */
    public IntSortedSet support(String register) {
        return state.support(register);
    }

    /**
     * Returns an independent system holding the branch's state. Agents and the random provider
     * are carried over.
     * @param branch a reachable branch of this system's state.
     * @return the branched system.
     */
    public QuantumSystem withState(Branch branch) {
        if (!branch.isReachable()) {
            throw new IllegalArgumentException("Branch " + branch.register() + "=" + branch.value() + " is unreachable");
        }
        return new QuantumSystem(requirements, interpretation, branch.state(), copyAgents(), random, printPrecision);
    }

    /**
     * @return a deep copy of this system sharing only the random provider.
     */
    public QuantumSystem copy() {
        return new QuantumSystem(requirements, interpretation, state.copy(), copyAgents(), random, printPrecision);
    }

    private Map<String, Agent> copyAgents() {
        Map<String, Agent> copies = new LinkedHashMap<>();
        agents.forEach((name, agent) -> copies.put(name, agent.copy()));
        return copies;
    }

    @Override
    public String toString() {
        return new StateFormatter(printPrecision).format(state);
    }
}
