package org.qthought.runtime.inference;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.qthought.runtime.QuantumSystem;
import org.qthought.runtime.interpretation.CopenhagenInterpretation;
import org.qthought.runtime.ops.Gates;
import org.qthought.runtime.protocol.Protocol;
import org.qthought.runtime.protocol.Step;
import org.qthought.runtime.protocol.StepAction;
import org.qthought.runtime.requirements.Requirements;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class BranchTreeTest {

    private final Requirements domain = Requirements.of("Qubit", "a", "b");

    private final Protocol protocol = Protocol.of(
            new Step(domain, "prepare", 0, StepAction.applyUnitary(Gates.H, "a")),
            new Step(domain, "measure", 1, StepAction.measure("a")),
            new Step(domain, "flip", 2, StepAction.applyUnitary(Gates.X, "b")));

    private BranchTree measuredTree() {
        QuantumSystem system = QuantumSystem.allocate(domain, new CopenhagenInterpretation());
        return BranchTree.root(system).runUntil(protocol, 1);
    }

    @Test
    void measurementSplitsIntoWeightedLeaves() {
        BranchTree tree = measuredTree();

        assertThat(tree.size()).isEqualTo(2);
        assertThat(tree.totalProbability()).isCloseTo(1.0, within(1e-12));
        assertThat(tree.leaves()).allSatisfy(leaf -> assertThat(leaf.probability()).isCloseTo(0.5, within(1e-12)));
        assertThat(tree.leaves()).allSatisfy(leaf -> assertThat(leaf.system().support("a")).hasSize(1));
        assertThat(tree.support("a")).containsExactly(0, 1);
    }

    @Test
    void laterStepsRunOnEveryLeaf() {
        BranchTree finished = measuredTree().runBetween(protocol, 1, 2);

        assertThat(finished.size()).isEqualTo(2);
        assertThat(finished.leaves()).allSatisfy(leaf -> assertThat(leaf.system().readout("b")).isEqualTo(1));
    }

    @Test
    void projectionCopiesLeavesAndDropsUnreachableOnes() {
        BranchTree tree = measuredTree();

        BranchTree projected = tree.project("a", 1);
        BranchTree impossible = tree.project("b", 1);

        assertThat(projected.size()).isEqualTo(1);
        assertThat(projected.support("a")).containsExactly(1);
        assertThat(impossible.isEmpty()).isTrue();
        assertThat(tree.support("a")).containsExactly(0, 1);
    }
}
