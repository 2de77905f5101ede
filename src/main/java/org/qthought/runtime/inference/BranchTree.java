package org.qthought.runtime.inference;

import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import org.qthought.runtime.QuantumSystem;
import org.qthought.runtime.model.Branch;
import org.qthought.runtime.protocol.ActionKind;
import org.qthought.runtime.protocol.Protocol;
import org.qthought.runtime.protocol.Step;
import org.qthought.runtime.protocol.StepAction;
import org.qthought.runtime.spi.IRandomProvider;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The set of classical branches a protocol run can be in, each with its own system and weight.
 * <p>
 * Measurement steps do not sample: every leaf splits into one leaf per reachable outcome, so
 * running a protocol through a tree is deterministic. All other steps run on every leaf.
 * Leaves own their systems exclusively.
 */
public final class BranchTree {

    /**
     * A branch of the run.
     *
     * @param system      the branch's private system
     * @param probability the weight of the branch relative to the tree's root
     */
    public record Leaf(QuantumSystem system, double probability) {
    }

    private final List<Leaf> leaves;

    private BranchTree(List<Leaf> leaves) {
        this.leaves = leaves;
    }

    /**
     * @param system the starting system, owned by the tree from now on.
     * @return a tree with a single leaf of weight one.
     */
    public static BranchTree root(QuantumSystem system) {
        List<Leaf> leaves = new ArrayList<>();
        leaves.add(new Leaf(system, 1.0));
        return new BranchTree(leaves);
    }

    public List<Leaf> leaves() {
        return Collections.unmodifiableList(leaves);
    }

    public int size() {
        return leaves.size();
    }

    public boolean isEmpty() {
        return leaves.isEmpty();
    }

    /**
     * @return the summed weight of all leaves.
     */
    public double totalProbability() {
        double total = 0.0;
        for (Leaf leaf : leaves) {
            total += leaf.probability();
        }
        return total;
    }

    /**
     * Runs every step with time at most {@code toTime}.
     * @param protocol the protocol.
     * @param toTime last time to run, inclusive.
     * @return the resulting tree; this tree's leaves must not be used afterwards.
     */
    public BranchTree runUntil(Protocol protocol, int toTime) {
        BranchTree tree = this;
        for (Step step : protocol.steps()) {
            if (step.getTime() <= toTime) {
                tree = tree.apply(protocol, step);
            }
        }
        return tree;
    }

    /**
     * Runs every step with time in {@code (afterTime, toTime]}.
     * @param protocol the protocol.
     * @param afterTime last time already run, exclusive.
     * @param toTime last time to run, inclusive.
     * @return the resulting tree; this tree's leaves must not be used afterwards.
     */
    public BranchTree runBetween(Protocol protocol, int afterTime, int toTime) {
        BranchTree tree = this;
        for (Step step : protocol.steps()) {
            if (step.getTime() > afterTime && step.getTime() <= toTime) {
                tree = tree.apply(protocol, step);
            }
        }
        return tree;
    }

    private BranchTree apply(Protocol protocol, Step step) {
        if (step.getAction().kind() != ActionKind.MEASURE) {
            for (Leaf leaf : leaves) {
                protocol.runStep(step, leaf.system(), true);
            }
            return this;
        }
        String register = ((StepAction.Measure) step.getAction()).register();
        List<Leaf> split = new ArrayList<>();
        for (Leaf leaf : leaves) {
            for (Branch branch : leaf.system().state().branches(register)) {
                split.add(new Leaf(leaf.system().withState(branch), leaf.probability() * branch.probability()));
            }
        }
        return new BranchTree(split);
    }

    /**
     * Projects a copy of every leaf onto one value of a register. This tree is left untouched,
     * so several projections may be taken concurrently.
     *
     * @param register the register.
     * @param value the value.
     * @return the reachable projected leaves, possibly none.
     */
    public BranchTree project(String register, int value) {
        List<Leaf> projected = new ArrayList<>();
        for (Leaf leaf : leaves) {
            Branch branch = leaf.system().state().projectTo(register, value);
            if (branch.isReachable()) {
                projected.add(new Leaf(leaf.system().withState(branch), leaf.probability() * branch.probability()));
            }
        }
        return new BranchTree(projected);
    }

    /**
     * Gives each leaf its own random stream derived from {@code random}, for custom actions that
     * sample.
     * @param random the parent provider.
     */
    public void reseed(IRandomProvider random) {
        for (int i = 0; i < leaves.size(); i++) {
            leaves.get(i).system().setRandomProvider(random.deriveFor("leaf", i));
        }
    }

    /**
     * @param register the register.
     * @return the union of the register's possible values over all leaves.
     */
    public IntSortedSet support(String register) {
        IntSortedSet values = new IntRBTreeSet();
        for (Leaf leaf : leaves) {
            values.addAll(leaf.system().support(register));
        }
        return values;
    }
}
