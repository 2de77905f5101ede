package org.qthought.runtime.agent;

import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectRBTreeMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectSortedMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectSortedMaps;
import it.unimi.dsi.fastutil.ints.IntCollection;
import it.unimi.dsi.fastutil.ints.IntIterator;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import it.unimi.dsi.fastutil.ints.IntSortedSets;

import java.util.Objects;

/**
 * Maps each value of an input register at an input time to the set of values an output register
 * can be found to hold at an output time on that branch.
 * <p>
 * Every entry is non-empty except for contradiction markers, which a consistency merge leaves
 * behind when no outcome is consistent with both observers; these keys are listed in
 * {@link #contradictions()}. Input values whose branch has zero amplitude are not entries at all:
 * they are listed in {@link #unreachableKeys()}.
 * <p>
 * Tables are immutable.
 */
public final class InferenceTable {

    private final Observation input;
    private final Observation output;
    private final Int2ObjectSortedMap<IntSortedSet> entries;
    private final IntSortedSet unreachableKeys;
    private final IntSortedSet contradictions;

    private InferenceTable(Builder builder) {
        this.input = builder.input;
        this.output = builder.output;
        Int2ObjectSortedMap<IntSortedSet> copy = new Int2ObjectRBTreeMap<>();
        IntSortedSet contradictory = new IntRBTreeSet();
        for (Int2ObjectMap.Entry<IntSortedSet> entry : builder.entries.int2ObjectEntrySet()) {
            copy.put(entry.getIntKey(), IntSortedSets.unmodifiable(new IntRBTreeSet(entry.getValue())));
            if (entry.getValue().isEmpty()) {
                contradictory.add(entry.getIntKey());
            }
        }
        this.entries = Int2ObjectSortedMaps.unmodifiable(copy);
        this.unreachableKeys = IntSortedSets.unmodifiable(new IntRBTreeSet(builder.unreachable));
        this.contradictions = IntSortedSets.unmodifiable(contradictory);
    }

    /**
     * @param input the observed register and time.
     * @param output the predicted register and time.
     * @return a builder for a new table.
     */
    public static Builder builder(Observation input, Observation output) {
        return new Builder(input, output);
    }

    /**
     * @param inputRegister the observed register.
     * @param inputTime the observation time.
     * @param outputRegister the predicted register.
     * @param outputTime the prediction time.
     * @return a builder for a new table.
     */
    public static Builder builder(String inputRegister, int inputTime, String outputRegister, int outputTime) {
        return new Builder(new Observation(inputRegister, inputTime), new Observation(outputRegister, outputTime));
    }

    /**
     * Builds the table mapping every value of a register to itself.
     * @param observation the register and time on both sides.
     * @param valueCount the number of values the register can hold.
     * @return the identity table.
     */
    public static InferenceTable identity(Observation observation, int valueCount) {
        Builder builder = builder(observation, observation);
        for (int value = 0; value < valueCount; value++) {
            builder.put(value, value);
        }
        return builder.build();
    }

    /**
     * @return the observed register and time.
     */
    public Observation input() {
        return input;
    }

    /**
     * @return the predicted register and time.
     */
    public Observation output() {
        return output;
    }

    /**
     * @param key an input value.
     * @return the possible output values, empty if the key is absent or contradictory.
     */
    public IntSortedSet get(int key) {
        IntSortedSet values = entries.get(key);
        return values == null ? IntSortedSets.EMPTY_SET : values;
    }

    /**
     * @param key an input value.
     * @return true if the table has an entry (possibly a contradiction marker) for the key.
     */
    public boolean containsKey(int key) {
        return entries.containsKey(key);
    }

    /**
     * @return the input values with entries, in ascending order.
     */
    public IntSortedSet keys() {
        return IntSortedSets.unmodifiable(new IntRBTreeSet(entries.keySet()));
    }

    /**
     * @return all entries, in ascending key order.
     */
    public Int2ObjectSortedMap<IntSortedSet> entries() {
        return entries;
    }

    /**
     * @return input values whose branch had zero amplitude.
     */
    public IntSortedSet unreachableKeys() {
        return unreachableKeys;
    }

    /**
     * @return input values whose entry is empty because no consistent outcome remained.
     */
    public IntSortedSet contradictions() {
        return contradictions;
    }

    /**
     * @return true if at least one entry is a contradiction marker.
     */
    public boolean isContradictory() {
        return !contradictions.isEmpty();
    }

    /**
     * @return the number of entries.
     */
    public int size() {
        return entries.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InferenceTable)) return false;
        InferenceTable that = (InferenceTable) o;
        return input.equals(that.input)
                && output.equals(that.output)
                && entries.equals(that.entries)
                && unreachableKeys.equals(that.unreachableKeys);
    }

    @Override
    public int hashCode() {
        return Objects.hash(input, output, entries, unreachableKeys);
    }

    @Override
    public String toString() {
        String header = String.format("%-22s|  Out: (%s)", "In:(" + input + ")", output);
        StringBuilder sb = new StringBuilder(header);
        sb.append('\n').append("-".repeat(header.length() + 7));
        for (Int2ObjectMap.Entry<IntSortedSet> entry : entries.int2ObjectEntrySet()) {
            String marker = entry.getValue().isEmpty() ? "  (contradiction)" : "";
            sb.append('\n').append(String.format("   %-12d|   %s%s", entry.getIntKey(), entry.getValue(), marker));
        }
        if (!unreachableKeys.isEmpty()) {
            sb.append('\n').append("unreachable: ").append(unreachableKeys);
        }
        return sb.toString();
    }

    /**
     * Collects entries for a new table.
     */
    public static final class Builder {

        private final Observation input;
        private final Observation output;
        private final Int2ObjectSortedMap<IntSortedSet> entries = new Int2ObjectRBTreeMap<>();
        private final IntSortedSet unreachable = new IntRBTreeSet();

        private Builder(Observation input, Observation output) {
            this.input = Objects.requireNonNull(input, "input");
            this.output = Objects.requireNonNull(output, "output");
        }

        /**
         * Adds output values to a key, creating the entry if needed.
         * @param key the input value.
         * @param values possible output values.
         * @return this builder.
         */
        public Builder put(int key, int... values) {
            IntSortedSet set = entry(key);
            for (int value : values) {
                set.add(checkValue(value));
            }
            return this;
        }

        /**
         * Adds output values to a key, creating the entry if needed. An empty collection creates a
         * contradiction marker.
         * @param key the input value.
         * @param values possible output values.
         * @return this builder.
         */
        public Builder putAll(int key, IntCollection values) {
            IntSortedSet set = entry(key);
            for (IntIterator it = values.iterator(); it.hasNext(); ) {
                set.add(checkValue(it.nextInt()));
            }
            return this;
        }

        /**
         * Flags an input value whose branch has zero amplitude.
         * @param key the input value.
         * @return this builder.
         */
        public Builder markUnreachable(int key) {
            if (entries.containsKey(key)) {
                throw new IllegalArgumentException("Key " + key + " has an entry and cannot be unreachable");
            }
            unreachable.add(checkValue(key));
            return this;
        }

        private IntSortedSet entry(int key) {
            checkValue(key);
            if (unreachable.contains(key)) {
                throw new IllegalArgumentException("Key " + key + " is flagged unreachable");
            }
            IntSortedSet set = entries.get(key);
            if (set == null) {
                set = new IntRBTreeSet();
                entries.put(key, set);
            }
            return set;
        }

        private static int checkValue(int value) {
            if (value < 0) {
                throw new IllegalArgumentException("Register values are non-negative, got " + value);
            }
            return value;
        }

        /**
         * @return the immutable table.
         */
        public InferenceTable build() {
            return new InferenceTable(this);
        }
    }
}
