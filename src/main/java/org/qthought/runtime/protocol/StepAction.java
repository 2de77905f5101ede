package org.qthought.runtime.protocol;

import org.qthought.runtime.Config;
import org.qthought.runtime.internal.services.ExecutionContext;
import org.qthought.runtime.ops.Operation;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * What a {@link Step} does when it executes. Actions are immutable values; the built-in variants
 * declare every register they touch so that a step can check them against its domain when it is
 * constructed.
 */
public abstract class StepAction {

    private final ActionKind kind;

    protected StepAction(ActionKind kind) {
        this.kind = kind;
    }

    public final ActionKind kind() {
        return kind;
    }

    /**
     * @return the registers this action touches, empty if it cannot be known in advance.
     */
    public abstract Set<String> registers();

    /**
     * Executes the action.
     * @param context the domain-scoped execution context.
     */
    public abstract void execute(ExecutionContext context);

    /**
     * Applies a unitary to the concatenation of the targets.
     * @param operation the unitary.
     * @param targets target registers, the first in the low bits.
     * @return the action.
     */
    public static StepAction applyUnitary(Operation operation, String... targets) {
        return new ApplyUnitary(operation, Arrays.asList(targets), Collections.emptyList());
    }

    /**
     * Applies a unitary controlled on every bit of the control registers.
     * @param operation the unitary.
     * @param targets target registers, the first in the low bits.
     * @param controls control registers.
     * @return the action.
     */
    public static StepAction controlledUnitary(Operation operation, List<String> targets, List<String> controls) {
        return new ApplyUnitary(operation, targets, controls);
    }

    /**
     * Lets a memory register record a source register.
     * @param memoryRegister the memory register, e.g. {@code Alice_memory}.
     * @param sourceRegister the observed register.
     * @return the action.
     */
    public static StepAction observe(String memoryRegister, String sourceRegister) {
        return new Observe(memoryRegister, sourceRegister, false);
    }

    /**
     * Undoes an observation.
     * @param memoryRegister the memory register.
     * @param sourceRegister the observed register.
     * @return the action.
     */
    public static StepAction unobserve(String memoryRegister, String sourceRegister) {
        return new Observe(memoryRegister, sourceRegister, true);
    }

    public static StepAction prepInference(String agentName) {
        return new PrepInference(agentName);
    }

    public static StepAction makeInference(String agentName) {
        return new MakeInference(agentName, false);
    }

    public static StepAction reverseInference(String agentName) {
        return new MakeInference(agentName, true);
    }

    public static StepAction measure(String register) {
        return new Measure(register);
    }

    public static StepAction logState() {
        return LogState.INSTANCE;
    }

    /**
     * @param id identifier of an action in the protocol's custom action table.
     * @return the action.
     */
    public static StepAction custom(String id) {
        return new Custom(id);
    }

    private static Set<String> agentRegisters(String agentName) {
        return Set.of(agentName + Config.MEMORY_SUFFIX, agentName + Config.PREDICTION_SUFFIX);
    }

    /**
     * Applies a (possibly controlled) unitary.
     */
    public static final class ApplyUnitary extends StepAction {
        private final Operation operation;
        private final List<String> targets;
        private final List<String> controls;

        ApplyUnitary(Operation operation, List<String> targets, List<String> controls) {
            super(ActionKind.APPLY_UNITARY);
            this.operation = Objects.requireNonNull(operation, "operation");
            this.targets = List.copyOf(targets);
            this.controls = List.copyOf(controls);
        }

        public Operation operation() {
            return operation;
        }

        public List<String> targets() {
            return targets;
        }

        public List<String> controls() {
            return controls;
        }

        @Override
        public Set<String> registers() {
            Set<String> all = new LinkedHashSet<>(targets);
            all.addAll(controls);
            return Collections.unmodifiableSet(all);
        }

        @Override
        public void execute(ExecutionContext context) {
            context.applyUnitary(operation, targets, controls);
        }

        @Override
        public String toString() {
            return operation.getName() + " on " + targets + (controls.isEmpty() ? "" : " controlled by " + controls);
        }
    }

    /**
     * Records a source register in a memory register, or undoes the record.
     */
    public static final class Observe extends StepAction {
        private final String memoryRegister;
        private final String sourceRegister;
        private final boolean reverse;

        Observe(String memoryRegister, String sourceRegister, boolean reverse) {
            super(ActionKind.OBSERVE);
            this.memoryRegister = Objects.requireNonNull(memoryRegister, "memoryRegister");
            this.sourceRegister = Objects.requireNonNull(sourceRegister, "sourceRegister");
            this.reverse = reverse;
        }

        public String memoryRegister() {
            return memoryRegister;
        }

        public String sourceRegister() {
            return sourceRegister;
        }

        public boolean isReverse() {
            return reverse;
        }

        @Override
        public Set<String> registers() {
            return Set.of(memoryRegister, sourceRegister);
        }

        @Override
        public void execute(ExecutionContext context) {
            context.observe(memoryRegister, sourceRegister, reverse);
        }

        @Override
        public String toString() {
            return (reverse ? "unobserve " : "observe ") + sourceRegister + " into " + memoryRegister;
        }
    }

    /**
     * Prepares an agent's prediction register for its inference.
     */
    public static final class PrepInference extends StepAction {
        private final String agentName;

        PrepInference(String agentName) {
            super(ActionKind.PREP_INFERENCE);
            this.agentName = Objects.requireNonNull(agentName, "agentName");
        }

        public String agentName() {
            return agentName;
        }

        @Override
        public Set<String> registers() {
            return agentRegisters(agentName);
        }

        @Override
        public void execute(ExecutionContext context) {
            context.prepInference(agentName);
        }

        @Override
        public String toString() {
            return "prepare inference of " + agentName;
        }
    }

    /**
     * Runs an agent's inference circuit or its inverse.
     */
    public static final class MakeInference extends StepAction {
        private final String agentName;
        private final boolean reverse;

        MakeInference(String agentName, boolean reverse) {
            super(ActionKind.MAKE_INFERENCE);
            this.agentName = Objects.requireNonNull(agentName, "agentName");
            this.reverse = reverse;
        }

        public String agentName() {
            return agentName;
        }

        public boolean isReverse() {
            return reverse;
        }

        @Override
        public Set<String> registers() {
            return agentRegisters(agentName);
        }

        @Override
        public void execute(ExecutionContext context) {
            context.makeInference(agentName, reverse);
        }

        @Override
        public String toString() {
            return (reverse ? "reverse inference of " : "inference of ") + agentName;
        }
    }

    /**
     * Measures a register in the computational basis.
     */
    public static final class Measure extends StepAction {
        private final String register;

        Measure(String register) {
            super(ActionKind.MEASURE);
            this.register = Objects.requireNonNull(register, "register");
        }

        public String register() {
            return register;
        }

        @Override
        public Set<String> registers() {
            return Set.of(register);
        }

        @Override
        public void execute(ExecutionContext context) {
            context.measure(register);
        }

        @Override
        public String toString() {
            return "measure " + register;
        }
    }

    /**
     * Logs the state dump of non-silent runs.
     */
    public static final class LogState extends StepAction {
        static final LogState INSTANCE = new LogState();

        private LogState() {
            super(ActionKind.LOG_STATE);
        }

        @Override
        public Set<String> registers() {
            return Collections.emptySet();
        }

        @Override
        public void execute(ExecutionContext context) {
            context.logState();
        }

        @Override
        public String toString() {
            return "log state";
        }
    }

    /**
     * Runs the custom action bound to an identifier in the protocol.
     */
    public static final class Custom extends StepAction {
        private final String id;

        Custom(String id) {
            super(ActionKind.CUSTOM);
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("Custom action id must not be blank");
            }
            this.id = id;
        }

        public String id() {
            return id;
        }

        @Override
        public Set<String> registers() {
            return Collections.emptySet();
        }

        @Override
        public void execute(ExecutionContext context) {
            context.resolveCustomAction(id).execute(context);
        }

        @Override
        public String toString() {
            return "custom " + id;
        }
    }
}
