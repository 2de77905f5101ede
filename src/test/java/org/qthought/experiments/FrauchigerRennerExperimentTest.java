package org.qthought.experiments;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.qthought.runtime.QuantumSystem;
import org.qthought.runtime.RuntimeSettings;
import org.qthought.runtime.agent.InferenceTable;
import org.qthought.runtime.inference.InferenceEngine;
import org.qthought.runtime.interpretation.CopenhagenInterpretation;
import org.qthought.runtime.protocol.Protocol;

import static org.assertj.core.api.Assertions.assertThat;
import static org.qthought.experiments.FrauchigerRennerExperiment.FAIL;
import static org.qthought.experiments.FrauchigerRennerExperiment.NO_PREDICTION;

@Tag("unit")
class FrauchigerRennerExperimentTest {

    private final CopenhagenInterpretation copenhagen = new CopenhagenInterpretation();
    private InferenceEngine engine;
    private Protocol protocol;

    @BeforeEach
    void setUp() {
        engine = new InferenceEngine(copenhagen);
        protocol = FrauchigerRennerExperiment.protocol();
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    void protocolAllocatesElevenQubits() {
        QuantumSystem system = QuantumSystem.allocate(protocol.getRequirements(), copenhagen);

        assertThat(system.layout().totalWidth()).isEqualTo(11);
        assertThat(system.agents()).containsOnlyKeys("Alice", "Bob", "Ursula");
        assertThat(protocol.times()).contains(0, 1, 7, 11, 14);
    }

    @Test
    void agentsDeriveTheExpectedTables() {
        FrauchigerRennerExperiment.AgentTables tables = FrauchigerRennerExperiment.deriveTables(protocol, engine);

        InferenceTable alice = tables.alice();
        assertThat(alice.get(0)).containsExactly(0, 1);
        assertThat(alice.get(1)).containsExactly(0);

        InferenceTable bob = tables.bob();
        assertThat(bob.get(0)).containsExactly(0, 1);
        assertThat(bob.get(1)).containsExactly(1);

        InferenceTable ursula = tables.ursula();
        assertThat(ursula.get(0)).containsExactly(0, 1);
        assertThat(ursula.get(1)).containsExactly(1);
    }

    @Test
    void ursulaConcludesFailFromOk() {
        FrauchigerRennerExperiment.AgentTables tables = FrauchigerRennerExperiment.deriveTables(protocol, engine);

        InferenceTable chained = tables.ursulaChained();

        assertThat(chained.input().register()).isEqualTo("Ursula_memory");
        assertThat(chained.output().register()).isEqualTo("s");
        assertThat(chained.get(1)).containsExactly(FAIL);
        assertThat(chained.get(0)).containsExactly(0, 1);
        assertThat(chained.isContradictory()).isFalse();
        assertThat(tables.bobChained().get(1)).containsExactly(FAIL);
    }

    @Test
    void ursulaOnlyPredictsWhenSheSawOk() {
        FrauchigerRennerExperiment.AgentTables tables = FrauchigerRennerExperiment.deriveTables(protocol, engine);
        QuantumSystem template = FrauchigerRennerExperiment.prepareSystem(protocol, tables, copenhagen,
                RuntimeSettings.defaults());

        for (int trial = 0; trial < 50; trial++) {
            QuantumSystem system = template.copy();
            system.setRandomProvider(system.randomProvider().deriveFor("test", trial));
            FrauchigerRennerExperiment.Outcome outcome = FrauchigerRennerExperiment.runTrial(protocol, system);
            int expected = outcome.ursulaMemory() == 1 ? FAIL : NO_PREDICTION;
            assertThat(outcome.ursulaPrediction()).isEqualTo(expected);
        }
    }

    @Test
    void outcomeWinsOnlyForOkFailOk() {
        assertThat(new FrauchigerRennerExperiment.Outcome(1, 0, 1).isWinning()).isTrue();
        assertThat(new FrauchigerRennerExperiment.Outcome(1, 0, 0).isWinning()).isFalse();
        assertThat(new FrauchigerRennerExperiment.Outcome(0, 2, 1).isWinning()).isFalse();
    }
}
