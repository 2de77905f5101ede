package org.qthought.runtime.requirements;

import org.qthought.runtime.Config;
import org.qthought.runtime.api.MalformedRequirementsException;
import org.qthought.runtime.model.RegisterDeclaration;
import org.qthought.runtime.model.RegisterRole;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A kind of resource a protocol can require, e.g. {@code Qubit}, {@code Qureg(3)},
 * {@code AgentMemory(1)} or {@code Agent(1,1)}.
 *
 * @param type            the kind family
 * @param width           register width (memory width for agents)
 * @param predictionWidth prediction register width for agents, 0 for every other type
 */
public record RequirementKind(Type type, int width, int predictionWidth) {

    private static final Pattern KIND_PATTERN =
            Pattern.compile("^\\s*([A-Za-z]+)\\s*(?:\\(\\s*(\\d+)\\s*(?:,\\s*(\\d+)\\s*)?\\))?\\s*$");

    /**
     * The families of requirement kinds.
     */
    public enum Type {
        QUBIT("Qubit"),
        QUREG("Qureg"),
        AGENT_MEMORY("AgentMemory"),
        AGENT("Agent");

        private final String label;

        Type(String label) {
            this.label = label;
        }

        /**
         * @return the label used in kind strings.
         */
        public String label() {
            return label;
        }

        static Type fromLabel(String label) {
            for (Type type : values()) {
                if (type.label.equals(label)) {
                    return type;
                }
            }
            throw new MalformedRequirementsException("Unknown requirement kind '" + label
                    + "'. Allowed: Qubit, Qureg(n), AgentMemory(n), Agent(n,m)");
        }
    }

    /** A single qubit. */
    public static final RequirementKind QUBIT = new RequirementKind(Type.QUBIT, 1, 0);

    public RequirementKind {
        if (type == null) {
            throw new MalformedRequirementsException("Requirement kind needs a type");
        }
        if (width <= 0) {
            throw new MalformedRequirementsException("Invalid width " + width + " for " + type.label());
        }
        if (type == Type.QUBIT && width != 1) {
            throw new MalformedRequirementsException("A Qubit has width 1, got " + width);
        }
        if (type == Type.AGENT && predictionWidth <= 0) {
            throw new MalformedRequirementsException("Invalid prediction width " + predictionWidth + " for Agent");
        }
        if (type != Type.AGENT && predictionWidth != 0) {
            throw new MalformedRequirementsException(type.label() + " has no prediction width");
        }
    }

    /**
     * @param width register width.
     * @return the {@code Qureg(width)} kind.
     */
    public static RequirementKind qureg(int width) {
        return new RequirementKind(Type.QUREG, width, 0);
    }

    /**
     * @param width memory width.
     * @return the {@code AgentMemory(width)} kind.
     */
    public static RequirementKind agentMemory(int width) {
        return new RequirementKind(Type.AGENT_MEMORY, width, 0);
    }

    /**
     * @param memoryWidth memory register width.
     * @param predictionWidth prediction register width.
     * @return the {@code Agent(memoryWidth,predictionWidth)} kind.
     */
    public static RequirementKind agent(int memoryWidth, int predictionWidth) {
        return new RequirementKind(Type.AGENT, memoryWidth, predictionWidth);
    }

    /**
     * Parses a kind string such as {@code "Agent(1,2)"}.
     * @param kind the kind string.
     * @return the parsed kind.
     * @throws MalformedRequirementsException if the string is not a valid kind.
     */
    public static RequirementKind parse(String kind) {
        if (kind == null) {
            throw new MalformedRequirementsException("Requirement kind must not be null");
        }
        Matcher matcher = KIND_PATTERN.matcher(kind);
        if (!matcher.matches()) {
            throw new MalformedRequirementsException("Cannot parse requirement kind '" + kind + "'");
        }
        Type type = Type.fromLabel(matcher.group(1));
        String first = matcher.group(2);
        String second = matcher.group(3);
        try {
            switch (type) {
                case QUBIT:
                    if (first != null) {
                        throw new MalformedRequirementsException("Qubit takes no size, got '" + kind + "'");
                    }
                    return QUBIT;
                case QUREG:
                case AGENT_MEMORY:
                    if (first == null || second != null) {
                        throw new MalformedRequirementsException(type.label() + " takes exactly one size, got '" + kind + "'");
                    }
                    return new RequirementKind(type, Integer.parseInt(first), 0);
                case AGENT:
                    if (first == null || second == null) {
                        throw new MalformedRequirementsException("Agent takes a memory and a prediction size, got '" + kind + "'");
                    }
                    return new RequirementKind(type, Integer.parseInt(first), Integer.parseInt(second));
                default:
                    throw new MalformedRequirementsException("Unsupported requirement kind '" + kind + "'");
            }
        } catch (NumberFormatException e) {
            throw new MalformedRequirementsException("Invalid size in requirement kind '" + kind + "'", e);
        }
    }

    /**
     * Expands a required name into the registers it allocates.
     * @param name the required name, e.g. an agent name.
     * @return the register declarations in storage order.
     */
    public List<RegisterDeclaration> registersFor(String name) {
        switch (type) {
            case QUBIT:
            case QUREG:
                return List.of(new RegisterDeclaration(name, RegisterRole.PLAIN, width));
            case AGENT_MEMORY:
                return List.of(new RegisterDeclaration(name + Config.MEMORY_SUFFIX, RegisterRole.MEMORY, width));
            case AGENT:
                return List.of(
                        new RegisterDeclaration(name + Config.MEMORY_SUFFIX, RegisterRole.MEMORY, width),
                        new RegisterDeclaration(name + Config.PREDICTION_SUFFIX, RegisterRole.PREDICTION, predictionWidth));
            default:
                throw new IllegalStateException("Unhandled type " + type);
        }
    }

    /**
     * An agent subsumes a bare agent memory of the same width for the same name.
     * @param other another kind.
     * @return true if a name declared with {@code other} is fully provided by this kind.
     */
    public boolean subsumes(RequirementKind other) {
        if (this.equals(other)) {
            return true;
        }
        return type == Type.AGENT && other.type == Type.AGENT_MEMORY && width == other.width;
    }

    @Override
    public String toString() {
        switch (type) {
            case QUBIT:
                return type.label();
            case AGENT:
                return type.label() + "(" + width + "," + predictionWidth + ")";
            default:
                return type.label() + "(" + width + ")";
        }
    }
}
