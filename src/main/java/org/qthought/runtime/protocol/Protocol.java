package org.qthought.runtime.protocol;

import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import it.unimi.dsi.fastutil.ints.IntSortedSets;
import org.qthought.runtime.QuantumSystem;
import org.qthought.runtime.api.ConflictException;
import org.qthought.runtime.api.UnsatisfiedRequirementsException;
import org.qthought.runtime.internal.services.ExecutionContext;
import org.qthought.runtime.requirements.Requirements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An immutable, time-ordered sequence of steps with the union of their requirements.
 * <p>
 * Protocols are composed with {@link #concat}: the steps of both operands are merged by time,
 * and steps with equal time keep their relative order, left operand first. Concatenation is
 * associative.
 */
public final class Protocol {

    private static final Logger LOG = LoggerFactory.getLogger(Protocol.class);

    private static final Protocol EMPTY = new Protocol(List.of(), Requirements.empty(), Map.of());

    private final List<Step> steps;
    private final Requirements requirements;
    private final Map<String, CustomAction> customActions;

    private Protocol(List<Step> steps, Requirements requirements, Map<String, CustomAction> customActions) {
        this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
        this.requirements = requirements;
        this.customActions = Collections.unmodifiableMap(new LinkedHashMap<>(customActions));
    }

    /**
     * @return the protocol without steps, the identity of {@link #concat}.
     */
    public static Protocol empty() {
        return EMPTY;
    }

    /**
     * @param steps the steps, in any order.
     * @return the protocol running them in time order.
     * @throws ConflictException if the steps' domains conflict.
     */
    public static Protocol of(Step... steps) {
        Protocol protocol = EMPTY;
        for (Step step : steps) {
            protocol = protocol.concat(step);
        }
        return protocol;
    }

    /**
     * @param step the step to add.
     * @return a protocol with the step merged in after all steps of equal time.
     */
    public Protocol concat(Step step) {
        return concat(new Protocol(List.of(step), step.getDomain(), Map.of()));
    }

    /**
     * Merges two protocols by time.
     *
     * @param other the right operand.
     * @return the merged protocol.
     * @throws ConflictException if the requirements conflict or both bind one custom action id
     *                           to different actions.
     */
    public Protocol concat(Protocol other) {
        Objects.requireNonNull(other, "other");
        Requirements merged = requirements.merge(other.requirements);
        Map<String, CustomAction> actions = new LinkedHashMap<>(customActions);
        other.customActions.forEach((id, action) -> bind(actions, id, action));

        List<Step> result = new ArrayList<>(steps.size() + other.steps.size());
        int i = 0;
        int j = 0;
        while (i < steps.size() && j < other.steps.size()) {
            if (other.steps.get(j).getTime() < steps.get(i).getTime()) {
                result.add(other.steps.get(j++));
            } else {
                result.add(steps.get(i++));
            }
        }
        result.addAll(steps.subList(i, steps.size()));
        result.addAll(other.steps.subList(j, other.steps.size()));
        return new Protocol(result, merged, actions);
    }

    /**
     * @see #concat(Protocol)
     */
    public static Protocol concat(Protocol a, Protocol b) {
        return a.concat(b);
    }

    /**
     * Binds a custom action identifier used by {@link StepAction#custom} steps.
     *
     * @param id the identifier.
     * @param action the action.
     * @return a protocol with the binding added.
     * @throws ConflictException if the id is already bound to a different action.
     */
    public Protocol withCustomAction(String id, CustomAction action) {
        Objects.requireNonNull(action, "action");
        Map<String, CustomAction> actions = new LinkedHashMap<>(customActions);
        bind(actions, id, action);
        return new Protocol(steps, requirements, actions);
    }

    private static void bind(Map<String, CustomAction> actions, String id, CustomAction action) {
        CustomAction existing = actions.putIfAbsent(id, action);
        if (existing != null && existing != action) {
            throw new ConflictException("Custom action '" + id + "' is bound to two different actions");
        }
    }

    /**
     * Runs every step on the system.
     *
     * @param system a system allocated with at least this protocol's requirements.
     * @param silent whether to suppress per-step logging.
     * @throws UnsatisfiedRequirementsException if the system lacks a required resource.
     */
    public void run(QuantumSystem system, boolean silent) {
        run(system, Integer.MIN_VALUE, Integer.MAX_VALUE, silent);
    }

    /**
     * Runs the steps whose time lies in {@code [fromTime, toTime]}.
     *
     * @param system a system allocated with at least this protocol's requirements.
     * @param fromTime first time to run, inclusive.
     * @param toTime last time to run, inclusive.
     * @param silent whether to suppress per-step logging.
     * @throws UnsatisfiedRequirementsException if the system lacks a required resource.
     */
    public void run(QuantumSystem system, int fromTime, int toTime, boolean silent) {
        checkSatisfiedBy(system);
        for (int index = 0; index < steps.size(); index++) {
            Step step = steps.get(index);
            if (step.getTime() < fromTime || step.getTime() > toTime) {
                continue;
            }
            if (!silent) {
                LOG.info("Step {}: {}", index, step);
            }
            runStep(step, system, silent);
            if (!silent) {
                LOG.info("{}", system);
            }
        }
    }

    /**
     * Executes one step of this protocol on a system that already passed
     * {@link #checkSatisfiedBy}.
     *
     * @param step the step.
     * @param system the system.
     * @param silent whether to suppress diagnostics output.
     */
    public void runStep(Step step, QuantumSystem system, boolean silent) {
        step.getAction().execute(new ExecutionContext(system, step, customActions, silent));
    }

    /**
     * @param system a system.
     * @throws UnsatisfiedRequirementsException if the system lacks a required resource.
     */
    public void checkSatisfiedBy(QuantumSystem system) {
        List<String> missing = requirements.missingFrom(system.requirements());
        if (!missing.isEmpty()) {
            throw new UnsatisfiedRequirementsException("System does not satisfy the protocol's requirements, missing "
                    + missing);
        }
    }

    public List<Step> steps() {
        return steps;
    }

    public Requirements getRequirements() {
        return requirements;
    }

    public Map<String, CustomAction> customActions() {
        return customActions;
    }

    public int size() {
        return steps.size();
    }

    /**
     * @return the distinct step times in ascending order.
     */
    public IntSortedSet times() {
        IntSortedSet times = new IntRBTreeSet();
        for (Step step : steps) {
            times.add(step.getTime());
        }
        return IntSortedSets.unmodifiable(times);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < steps.size(); i++) {
            sb.append("Step ").append(i).append(": ").append(steps.get(i)).append('\n');
        }
        return sb.append('\n').append(requirements).toString();
    }
}
