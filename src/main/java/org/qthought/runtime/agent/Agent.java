package org.qthought.runtime.agent;

import it.unimi.dsi.fastutil.ints.IntSortedSet;
import org.qthought.runtime.QuantumSystem;
import org.qthought.runtime.api.DimensionException;
import org.qthought.runtime.model.Register;
import org.qthought.runtime.model.StateVector;
import org.qthought.runtime.ops.Gates;
import org.qthought.runtime.ops.Operation;
import org.qthought.runtime.spi.IInterpretation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * A named reasoning observer owning a memory register and a prediction register.
 * <p>
 * An agent reasons with a classical inference table: memory value {@code m} resolves to the
 * single output value of the table's entry, or to the agent's no-prediction value when the entry
 * is missing, ambiguous or contradictory. The inference circuit writes that resolved value into
 * the prediction register coherently, so it can be undone by a reverse inference.
 * <p>
 * Agents belong to exactly one {@link QuantumSystem} and are copied with it.
 */
public final class Agent {

    private static final Logger LOG = LoggerFactory.getLogger(Agent.class);

    private final String name;
    private final Register memory;
    private final Register prediction;

    private InferenceTable inferenceTable;
    private int noPredictionValue;
    private int[] predictions;
    private boolean prepared;

    /**
     * Creates an agent without an inference table.
     * @param name the agent name.
     * @param memory the memory register.
     * @param prediction the prediction register.
     */
    public Agent(String name, Register memory, Register prediction) {
        this.name = Objects.requireNonNull(name, "name");
        this.memory = Objects.requireNonNull(memory, "memory");
        this.prediction = Objects.requireNonNull(prediction, "prediction");
        this.predictions = new int[memory.valueCount()];
    }

    private Agent(Agent other) {
        this.name = other.name;
        this.memory = other.memory;
        this.prediction = other.prediction;
        this.inferenceTable = other.inferenceTable;
        this.noPredictionValue = other.noPredictionValue;
        this.predictions = other.predictions.clone();
        this.prepared = other.prepared;
    }

    /**
     * @return an independent copy sharing the immutable inference table.
     */
    public Agent copy() {
        return new Agent(this);
    }

    public String getName() {
        return name;
    }

    public Register memory() {
        return memory;
    }

    public Register prediction() {
        return prediction;
    }

    /**
     * Loads the table the agent reasons with. Must be followed by {@link #prepInference} before
     * the inference runs.
     *
     * @param table the table, its input being this agent's memory.
     * @param noPredictionValue the prediction written when the table gives no single answer.
     * @throws IllegalArgumentException if the table's input is not this agent's memory.
     * @throws DimensionException if a key does not fit the memory or a resolved value does not
     *                            fit the prediction register.
     */
    public void setInferenceTable(InferenceTable table, int noPredictionValue) {
        Objects.requireNonNull(table, "table");
        if (!table.input().register().equals(memory.name())) {
            throw new IllegalArgumentException("Agent " + name + " reasons from " + memory.name()
                    + " but the table's input is " + table.input());
        }
        checkFits(noPredictionValue, prediction, "no-prediction value");
        int[] resolved = new int[memory.valueCount()];
        Arrays.fill(resolved, noPredictionValue);
        for (int key : table.keys()) {
            checkFits(key, memory, "table key");
            IntSortedSet values = table.get(key);
            if (values.size() == 1) {
                resolved[key] = checkFits(values.firstInt(), prediction, "prediction for key " + key);
            }
        }
        this.inferenceTable = table;
        this.noPredictionValue = noPredictionValue;
        this.predictions = resolved;
        this.prepared = false;
        LOG.debug("Agent {} loaded inference table {} -> {}, predictions {}", name, table.input(), table.output(),
                Arrays.toString(resolved));
    }

    /**
     * @return the loaded table, if any.
     */
    public Optional<InferenceTable> inferenceTable() {
        return Optional.ofNullable(inferenceTable);
    }

    public boolean hasInferenceTable() {
        return inferenceTable != null;
    }

    public int noPredictionValue() {
        return noPredictionValue;
    }

    /**
     * @param memoryValue a memory value.
     * @return the value the inference writes into the prediction register for it.
     */
    public int predictionFor(int memoryValue) {
        if (memoryValue < 0 || memoryValue >= predictions.length) {
            throw new DimensionException("Memory value " + memoryValue + " does not fit " + memory.name());
        }
        return predictions[memoryValue];
    }

    public boolean isPrepared() {
        return prepared;
    }

    /**
     * Writes the no-prediction value into the prediction register so that the inference leaves
     * exactly the resolved prediction behind.
     * @param state the state the agent lives in.
     */
    public void prepInference(StateVector state) {
        if (noPredictionValue != 0) {
            state.applyUnitary(Gates.xorMask(prediction.width(), noPredictionValue),
                    prediction.name());
        }
        prepared = true;
    }

    /**
     * Runs the inference circuit on memory and prediction, or its inverse.
     *
     * @param state the state the agent lives in.
     * @param interpretation the interpretation providing the circuit.
     * @param reverse whether to undo a previous inference.
     * @throws IllegalStateException if a table was loaded but not prepared.
     */
    public void makeInference(StateVector state, IInterpretation interpretation, boolean reverse) {
        if (inferenceTable == null) {
            LOG.debug("Agent {} has no inference table, inference acts as the identity", name);
        } else if (!prepared) {
            throw new IllegalStateException("Agent " + name + " must prepare its inference before making it");
        }
        Operation operation = interpretation.inferenceUnitary(this);
        state.applyUnitary(reverse ? operation.adjoint() : operation, memory.name(), prediction.name());
    }

    /**
     * Copies the value of {@code source} into this agent's memory, or undoes the copy.
     * @param system the system the agent belongs to.
     * @param source the observed register.
     * @param reverse whether to undo a previous observation.
     */
    public void observe(QuantumSystem system, String source, boolean reverse) {
        system.observe(memory.name(), source, reverse);
    }

    private static int checkFits(int value, Register register, String what) {
        if (value < 0 || value >= register.valueCount()) {
            throw new DimensionException("The " + what + " " + value + " does not fit register '"
                    + register.name() + "' of width " + register.width());
        }
        return value;
    }

    @Override
    public String toString() {
        return "Agent{" + name + ", memory=" + memory.name() + ", prediction=" + prediction.name()
                + (inferenceTable == null ? "" : ", predictions=" + Arrays.toString(predictions)) + "}";
    }
}
