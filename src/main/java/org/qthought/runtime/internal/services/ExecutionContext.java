package org.qthought.runtime.internal.services;

import it.unimi.dsi.fastutil.ints.IntSortedSet;
import org.qthought.runtime.Config;
import org.qthought.runtime.QuantumSystem;
import org.qthought.runtime.api.UnsatisfiedRequirementsException;
import org.qthought.runtime.ops.Operation;
import org.qthought.runtime.protocol.CustomAction;
import org.qthought.runtime.protocol.Step;
import org.qthought.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Everything a step action may touch while it executes: the system, restricted to the registers
 * of the step's domain, and the protocol's custom action table.
 * <p>
 * A context is created per step execution and passed to the action, so actions never reach the
 * system directly. Accessing a register outside the domain raises
 * {@link UnsatisfiedRequirementsException}.
 */
public class ExecutionContext {

    private static final Logger LOG = LoggerFactory.getLogger(ExecutionContext.class);

    private final QuantumSystem system;
    private final Step step;
    private final Set<String> allowedRegisters;
    private final Map<String, CustomAction> customActions;
    private final boolean silent;

    /**
     * @param system the system the step runs on.
     * @param step the executing step.
     * @param customActions the protocol's custom action table.
     * @param silent whether diagnostics output is suppressed.
     */
    public ExecutionContext(QuantumSystem system, Step step, Map<String, CustomAction> customActions, boolean silent) {
        this.system = system;
        this.step = step;
        this.allowedRegisters = step.getDomain().registerNames();
        this.customActions = customActions;
        this.silent = silent;
    }

    public Step getStep() {
        return step;
    }

    public boolean isSilent() {
        return silent;
    }

    /**
     * @return the random provider measurements sample from.
     */
    public IRandomProvider getRandomProvider() {
        return system.randomProvider();
    }

    public void applyUnitary(Operation operation, String... targets) {
        applyUnitary(operation, Arrays.asList(targets), Collections.emptyList());
    }

    public void applyUnitary(Operation operation, List<String> targets, List<String> controls) {
        checkAll(targets);
        checkAll(controls);
        system.applyUnitary(operation, targets, controls);
    }

    public void observe(String memoryRegister, String sourceRegister, boolean reverse) {
        check(memoryRegister);
        check(sourceRegister);
        system.observe(memoryRegister, sourceRegister, reverse);
    }

    public void prepInference(String agentName) {
        checkAgent(agentName);
        system.prepInference(agentName);
    }

    public void makeInference(String agentName, boolean reverse) {
        checkAgent(agentName);
        system.makeInference(agentName, reverse);
    }

    public int measure(String register) {
        check(register);
        return system.measure(register);
    }

    public int readout(String register) {
        check(register);
        return system.readout(register);
    }

    public IntSortedSet support(String register) {
        check(register);
        return system.support(register);
    }

    public double[] probabilities(String register) {
        check(register);
        return system.state().probabilities(register);
    }

    /**
     * Logs the state dump unless the run is silent.
     */
    public void logState() {
        if (!silent) {
            LOG.info("State at {}:\n{}", step, system);
        }
    }

    /**
     * @param id a custom action identifier.
     * @return the bound action.
     * @throws IllegalStateException if the protocol binds no action to the identifier.
     */
    public CustomAction resolveCustomAction(String id) {
        CustomAction action = customActions.get(id);
        if (action == null) {
            throw new IllegalStateException("No custom action bound to '" + id + "' for step " + step);
        }
        return action;
    }

    private void checkAgent(String agentName) {
        check(agentName + Config.MEMORY_SUFFIX);
        check(agentName + Config.PREDICTION_SUFFIX);
    }

    private void checkAll(List<String> registers) {
        for (String register : registers) {
            check(register);
        }
    }

    private void check(String register) {
        if (!allowedRegisters.contains(register)) {
            throw new UnsatisfiedRequirementsException("Step '" + step + "' accesses register '" + register
                    + "' outside its domain " + allowedRegisters);
        }
    }
}
