package org.qthought.experiments;

import org.qthought.runtime.ops.Gates;
import org.qthought.runtime.protocol.Protocol;
import org.qthought.runtime.protocol.Step;
import org.qthought.runtime.protocol.StepAction;
import org.qthought.runtime.requirements.Requirements;

/**
 * Two observers looking at the same qubit in superposition: a qubit {@code s} is put into
 * {@code |+>}, then Alice and Bob record it in their memories. Their memories end up perfectly
 * correlated.
 */
public final class SimpleExperiment {

    public static final String QUBIT = "s";
    public static final String ALICE = "Alice";
    public static final String BOB = "Bob";
    public static final String ALICE_MEMORY = ALICE + "_memory";
    public static final String BOB_MEMORY = BOB + "_memory";

    public static final int T_PREPARE = 0;
    public static final int T_ALICE_OBSERVES = 1;
    public static final int T_BOB_OBSERVES = 2;

    private SimpleExperiment() {
    }

    /**
     * @return the three-step protocol.
     */
    public static Protocol protocol() {
        Requirements qubit = Requirements.of("Qubit", QUBIT);
        return Protocol.of(
                new Step(qubit, "Prepare s in |+>", T_PREPARE, StepAction.applyUnitary(Gates.H, QUBIT)),
                new Step(qubit.merge(Requirements.of("AgentMemory(1)", ALICE)), "Alice observes s",
                        T_ALICE_OBSERVES, StepAction.observe(ALICE_MEMORY, QUBIT)),
                new Step(qubit.merge(Requirements.of("AgentMemory(1)", BOB)), "Bob observes s",
                        T_BOB_OBSERVES, StepAction.observe(BOB_MEMORY, QUBIT)));
    }
}
