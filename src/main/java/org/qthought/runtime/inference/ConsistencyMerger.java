package org.qthought.runtime.inference;

import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import org.qthought.runtime.agent.InferenceTable;
import org.qthought.runtime.api.ContradictionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Composes inference tables: if an agent infers B from A and another infers C from B, the merged
 * table infers C from A.
 * <p>
 * For every key {@code k} of the left table the merged entry is the union of the right table's
 * entries for all values in {@code left[k]}; values missing from the right table contribute
 * nothing. An empty merged entry is kept as a contradiction marker, never dropped, which keeps
 * the composition associative.
 */
public final class ConsistencyMerger {

    private static final Logger LOG = LoggerFactory.getLogger(ConsistencyMerger.class);

    private ConsistencyMerger() {
        // static only
    }

    /**
     * @param a table from X to Y.
     * @param b table from Y to Z.
     * @return the table from X to Z.
     * @throws IllegalArgumentException if {@code a}'s output is not {@code b}'s input.
     */
    public static InferenceTable consistency(InferenceTable a, InferenceTable b) {
        return merge(a, b, null);
    }

    /**
     * Merges two tables and keeps, per key, only the values the reference table also allows.
     *
     * @param a table from X to Y.
     * @param b table from Y to Z.
     * @param reference table from X to Z restricting the result.
     * @return the restricted table from X to Z.
     * @throws IllegalArgumentException if the tables do not line up.
     */
    public static InferenceTable consistency(InferenceTable a, InferenceTable b, InferenceTable reference) {
        if (!reference.input().equals(a.input()) || !reference.output().equals(b.output())) {
            throw new IllegalArgumentException("Reference table " + reference.input() + " -> " + reference.output()
                    + " does not match " + a.input() + " -> " + b.output());
        }
        return merge(a, b, reference);
    }

    /**
     * Folds {@link #consistency(InferenceTable, InferenceTable)} from left to right.
     * @param tables at least one table, each starting where the previous one ends.
     * @return the composed table.
     */
    public static InferenceTable chain(InferenceTable... tables) {
        if (tables.length == 0) {
            throw new IllegalArgumentException("Nothing to chain");
        }
        InferenceTable result = tables[0];
        for (int i = 1; i < tables.length; i++) {
            result = consistency(result, tables[i]);
        }
        return result;
    }

    /**
     * @param table a merged table.
     * @return the table, if it has no contradiction markers.
     * @throws ContradictionException listing the contradictory keys otherwise.
     */
    public static InferenceTable requireConsistent(InferenceTable table) throws ContradictionException {
        if (table.isContradictory()) {
            throw new ContradictionException("Inference " + table.input() + " -> " + table.output()
                    + " is contradictory for keys " + table.contradictions(), table.contradictions());
        }
        return table;
    }

    private static InferenceTable merge(InferenceTable a, InferenceTable b, InferenceTable reference) {
        if (!a.output().equals(b.input())) {
            throw new IllegalArgumentException("Cannot chain " + a.input() + " -> " + a.output() + " with "
                    + b.input() + " -> " + b.output() + ": " + a.output() + " is not " + b.input());
        }
        InferenceTable.Builder builder = InferenceTable.builder(a.input(), b.output());
        for (Int2ObjectMap.Entry<IntSortedSet> entry : a.entries().int2ObjectEntrySet()) {
            IntSortedSet merged = new IntRBTreeSet();
            for (int intermediate : entry.getValue()) {
                merged.addAll(b.get(intermediate));
            }
            if (reference != null) {
                merged.retainAll(reference.get(entry.getIntKey()));
            }
            builder.putAll(entry.getIntKey(), merged);
        }
        for (int unreachable : a.unreachableKeys()) {
            builder.markUnreachable(unreachable);
        }
        InferenceTable result = builder.build();
        if (result.isContradictory()) {
            LOG.info("Consistency {} -> {} -> {} leaves no outcome for keys {}", a.input(), a.output(), b.output(),
                    result.contradictions());
        }
        return result;
    }
}
