package org.qthought.runtime.protocol;

import org.qthought.runtime.api.MalformedRequirementsException;
import org.qthought.runtime.requirements.Requirements;

import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * A single timed action of a protocol with the resources it needs.
 * <p>
 * The action may only touch registers of the step's domain; built-in actions are checked when the
 * step is created.
 */
public final class Step {

    private final Requirements domain;
    private final String description;
    private final int time;
    private final StepAction action;

    /**
     * @param domain the resources the action touches.
     * @param description a human readable description.
     * @param time the protocol time; steps run in ascending time order.
     * @param action what the step does.
     * @throws MalformedRequirementsException if the action touches a register outside the domain.
     */
    public Step(Requirements domain, String description, int time, StepAction action) {
        this.domain = Objects.requireNonNull(domain, "domain");
        this.description = Objects.requireNonNull(description, "description");
        this.time = time;
        this.action = Objects.requireNonNull(action, "action");
        Set<String> outside = new TreeSet<>(action.registers());
        outside.removeAll(domain.registerNames());
        if (!outside.isEmpty()) {
            throw new MalformedRequirementsException("Step '" + description + "' (" + action
                    + ") touches registers outside its domain: " + outside);
        }
    }

    public Requirements getDomain() {
        return domain;
    }

    public String getDescription() {
        return description;
    }

    public int getTime() {
        return time;
    }

    public StepAction getAction() {
        return action;
    }

    /**
     * @return a single-step protocol.
     */
    public Protocol toProtocol() {
        return Protocol.of(this);
    }

    @Override
    public String toString() {
        return description + "(t:" + time + ")";
    }
}
