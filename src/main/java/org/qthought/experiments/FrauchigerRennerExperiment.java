package org.qthought.experiments;

import org.qthought.runtime.QuantumSystem;
import org.qthought.runtime.RuntimeSettings;
import org.qthought.runtime.agent.InferenceTable;
import org.qthought.runtime.inference.ConsistencyMerger;
import org.qthought.runtime.inference.InferenceEngine;
import org.qthought.runtime.ops.Gates;
import org.qthought.runtime.ops.MatrixOperation;
import org.qthought.runtime.ops.Operation;
import org.qthought.runtime.protocol.Protocol;
import org.qthought.runtime.protocol.Step;
import org.qthought.runtime.protocol.StepAction;
import org.qthought.runtime.requirements.Requirements;
import org.qthought.runtime.spi.IInterpretation;
import org.qthought.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The Frauchiger-Renner extended Wigner's friend scenario.
 * <p>
 * A qubit {@code r} is prepared in {@code sqrt(1/3)|0> + sqrt(2/3)|1>}. Alice observes it and
 * prepares {@code s} in {@code |+>} if she saw 1. Bob observes {@code s}. Ursula then undoes
 * Alice's lab, measures {@code r} in the Hadamard basis and, reasoning with the chain of the
 * three agents' inferences, predicts the outcome of Wigner's final Hadamard-basis measurement of
 * Bob's lab. Value 1 of Ursula's memory and of Wigner's result means "ok"; prediction 0 means
 * "fail" and prediction 2 means "no prediction".
 * <p>
 * A trial wins when Ursula observes ok, confidently predicts fail, and Wigner nevertheless gets
 * ok. Quantum mechanics gives this a probability of 1/12.
 */
public final class FrauchigerRennerExperiment {

    private static final Logger LOG = LoggerFactory.getLogger(FrauchigerRennerExperiment.class);

    public static final String R = "r";
    public static final String S = "s";
    public static final String ALICE = "Alice";
    public static final String BOB = "Bob";
    public static final String URSULA = "Ursula";
    public static final String ALICE_MEMORY = ALICE + "_memory";
    public static final String BOB_MEMORY = BOB + "_memory";
    public static final String URSULA_MEMORY = URSULA + "_memory";
    public static final String URSULA_PREDICTION = URSULA + "_prediction";

    public static final int OK = 1;
    public static final int FAIL = 0;
    public static final int NO_PREDICTION = 2;

    public static final int T_INIT_R = 1;
    public static final int T_ALICE_OBSERVES = 2;
    public static final int T_ALICE_INFERS = 3;
    public static final int T_PREPARE_S = 4;
    public static final int T_BOB_OBSERVES = 5;
    public static final int T_BOB_INFERS = 6;
    public static final int T_UNDO_ALICE = 7;
    public static final int T_ROTATE_R = 8;
    public static final int T_URSULA_OBSERVES = 9;
    public static final int T_URSULA_INFERS = 10;
    public static final int T_URSULA_ANNOUNCES = 11;
    public static final int T_UNDO_BOB = 12;
    public static final int T_ROTATE_S = 13;
    public static final int T_WIGNER_MEASURES = 14;

    private static final Operation INIT_R = MatrixOperation.real("InitR", new double[][]{
            {Math.sqrt(1.0 / 3.0), -Math.sqrt(2.0 / 3.0)},
            {Math.sqrt(2.0 / 3.0), Math.sqrt(1.0 / 3.0)}});

    private FrauchigerRennerExperiment() {
    }

    /**
     * The tables each agent derives, and the ones they reason with after chaining.
     *
     * @param alice  Alice's memory at t2 to Wigner's qubit at t14
     * @param bob    Bob's memory at t5 back to Alice's memory at t2
     * @param ursula Ursula's memory at t9 back to Bob's memory at t5
     */
    public record AgentTables(InferenceTable alice, InferenceTable bob, InferenceTable ursula) {

        /**
         * @return Bob's prediction of {@code s} at t14.
         */
        public InferenceTable bobChained() {
            return ConsistencyMerger.consistency(bob, alice);
        }

        /**
         * @return Ursula's prediction of {@code s} at t14.
         */
        public InferenceTable ursulaChained() {
            return ConsistencyMerger.chain(ursula, bob, alice);
        }
    }

    /**
     * The outcome of one trial.
     *
     * @param ursulaMemory     what Ursula observed
     * @param ursulaPrediction what Ursula announced
     * @param wignerResult     what Wigner measured
     */
    public record Outcome(int ursulaMemory, int ursulaPrediction, int wignerResult) {

        /**
         * @return true if Ursula saw ok, predicted fail, and Wigner got ok.
         */
        public boolean isWinning() {
            return ursulaMemory == OK && ursulaPrediction == FAIL && wignerResult == OK;
        }
    }

    /**
     * @return the full protocol, including the preparation of every agent's inference at t0.
     */
    public static Protocol protocol() {
        Requirements r = Requirements.of("Qubit", R);
        Requirements s = Requirements.of("Qubit", S);
        Requirements alice = Requirements.of("Agent(1,2)", ALICE);
        Requirements bob = Requirements.of("Agent(1,2)", BOB);
        Requirements ursula = Requirements.of("Agent(1,2)", URSULA);
        Requirements aliceMemory = Requirements.of("AgentMemory(1)", ALICE);
        Requirements bobMemory = Requirements.of("AgentMemory(1)", BOB);
        Requirements ursulaMemory = Requirements.of("AgentMemory(1)", URSULA);

        return Protocol.of(
                new Step(alice, "Alice prepares her inference", 0, StepAction.prepInference(ALICE)),
                new Step(bob, "Bob prepares his inference", 0, StepAction.prepInference(BOB)),
                new Step(ursula, "Ursula prepares her inference", 0, StepAction.prepInference(URSULA)),
                new Step(r, "Prepare r", T_INIT_R, StepAction.applyUnitary(INIT_R, R)),
                new Step(aliceMemory.merge(r), "Alice observes r", T_ALICE_OBSERVES,
                        StepAction.observe(ALICE_MEMORY, R)),
                new Step(alice, "Alice makes an inference", T_ALICE_INFERS, StepAction.makeInference(ALICE)),
                new Step(aliceMemory.merge(s), "Alice prepares s", T_PREPARE_S,
                        StepAction.controlledUnitary(Gates.H, List.of(S), List.of(ALICE_MEMORY))),
                new Step(bobMemory.merge(s), "Bob observes s", T_BOB_OBSERVES, StepAction.observe(BOB_MEMORY, S)),
                new Step(bob, "Bob makes an inference", T_BOB_INFERS, StepAction.makeInference(BOB)),
                new Step(alice, "Alice's inference is reversed", T_UNDO_ALICE, StepAction.reverseInference(ALICE)),
                new Step(aliceMemory.merge(r), "Alice's observation is reversed", T_UNDO_ALICE,
                        StepAction.unobserve(ALICE_MEMORY, R)),
                new Step(r, "Rotate r to Ursula's basis", T_ROTATE_R, StepAction.applyUnitary(Gates.H, R)),
                new Step(ursulaMemory.merge(r), "Ursula observes r", T_URSULA_OBSERVES,
                        StepAction.observe(URSULA_MEMORY, R)),
                new Step(ursula, "Ursula makes an inference", T_URSULA_INFERS, StepAction.makeInference(URSULA)),
                new Step(ursula, "Ursula announces her prediction", T_URSULA_ANNOUNCES,
                        StepAction.measure(URSULA_PREDICTION)),
                new Step(ursula, "Ursula's observation is recorded", T_URSULA_ANNOUNCES,
                        StepAction.measure(URSULA_MEMORY)),
                new Step(bob, "Bob's inference is reversed", T_UNDO_BOB, StepAction.reverseInference(BOB)),
                new Step(bobMemory.merge(s), "Bob's observation is reversed", T_UNDO_BOB,
                        StepAction.unobserve(BOB_MEMORY, S)),
                new Step(s, "Rotate s to Wigner's basis", T_ROTATE_S, StepAction.applyUnitary(Gates.H, S)),
                new Step(s, "Wigner measures s", T_WIGNER_MEASURES, StepAction.measure(S)));
    }

    /**
     * Derives the three agents' tables from the protocol.
     * @param protocol the protocol from {@link #protocol()}.
     * @param engine the inference engine.
     * @return the tables.
     */
    public static AgentTables deriveTables(Protocol protocol, InferenceEngine engine) {
        InferenceTable alice = engine.forwardInference(protocol, ALICE_MEMORY, T_ALICE_OBSERVES, S, T_WIGNER_MEASURES);
        InferenceTable bob = engine.backwardInference(protocol, BOB_MEMORY, T_BOB_OBSERVES, ALICE_MEMORY, T_ALICE_OBSERVES);
        InferenceTable ursula = engine.backwardInference(protocol, URSULA_MEMORY, T_URSULA_OBSERVES,
                BOB_MEMORY, T_BOB_OBSERVES);
        LOG.debug("Alice:\n{}\nBob:\n{}\nUrsula:\n{}", alice, bob, ursula);
        return new AgentTables(alice, bob, ursula);
    }

    /**
     * Allocates a system for the protocol and loads every agent's chained table.
     *
     * @param protocol the protocol.
     * @param tables the derived tables.
     * @param interpretation the interpretation.
     * @param settings engine settings.
     * @return a system ready to run the protocol.
     */
    public static QuantumSystem prepareSystem(Protocol protocol, AgentTables tables, IInterpretation interpretation,
                                              RuntimeSettings settings) {
        QuantumSystem system = QuantumSystem.allocate(protocol.getRequirements(), interpretation, settings);
        system.agent(ALICE).setInferenceTable(tables.alice(), NO_PREDICTION);
        system.agent(BOB).setInferenceTable(tables.bobChained(), NO_PREDICTION);
        system.agent(URSULA).setInferenceTable(tables.ursulaChained(), NO_PREDICTION);
        return system;
    }

    /**
     * Runs the protocol once on a prepared system and reads the outcome.
     * @param protocol the protocol.
     * @param system a system from {@link #prepareSystem}, consumed by the run.
     * @return the outcome.
     */
    public static Outcome runTrial(Protocol protocol, QuantumSystem system) {
        protocol.run(system, true);
        return new Outcome(system.readout(URSULA_MEMORY), system.readout(URSULA_PREDICTION), system.readout(S));
    }

    /**
     * Derives the tables and runs independent trials, each with its own random stream.
     *
     * @param interpretation the interpretation.
     * @param settings engine settings; the seed determines every trial.
     * @param trials the number of trials.
     * @return the counts of winning trials.
     */
    public static TrialStatistics runTrials(IInterpretation interpretation, RuntimeSettings settings, int trials) {
        Protocol protocol = protocol();
        AgentTables tables;
        try (InferenceEngine engine = new InferenceEngine(interpretation, settings)) {
            tables = deriveTables(protocol, engine);
        }
        QuantumSystem template = prepareSystem(protocol, tables, interpretation, settings);
        IRandomProvider root = settings.newRandomProvider();
        TrialStatistics statistics = new TrialStatistics(0, 0);
        for (int trial = 0; trial < trials; trial++) {
            QuantumSystem system = template.copy();
            system.setRandomProvider(root.deriveFor("trial", trial));
            statistics = statistics.record(runTrial(protocol, system).isWinning());
        }
        LOG.info("Frauchiger-Renner under '{}': {}", interpretation.getName(), statistics);
        return statistics;
    }
}
