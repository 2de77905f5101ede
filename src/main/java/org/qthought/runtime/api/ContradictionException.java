package org.qthought.runtime.api;

import it.unimi.dsi.fastutil.ints.IntSortedSet;
import it.unimi.dsi.fastutil.ints.IntSortedSets;

/**
 * Signals that merging the inference tables of two observers left at least one observation
 * without any consistent outcome.
 * <p>
 * This is a checked exception on purpose: in experiments such as Frauchiger-Renner a
 * contradiction is the result being studied, and callers must decide how to treat it.
 */
public class ContradictionException extends Exception {

    private final IntSortedSet contradictoryKeys;

    /**
     * Constructs a new contradiction exception.
     * @param message The detail message.
     * @param contradictoryKeys The input values for which no consistent outcome remains.
     */
    public ContradictionException(String message, IntSortedSet contradictoryKeys) {
        super(message);
        this.contradictoryKeys = IntSortedSets.unmodifiable(contradictoryKeys);
    }

    /**
     * @return the input values for which the merged table is empty.
     */
    public IntSortedSet getContradictoryKeys() {
        return contradictoryKeys;
    }
}
