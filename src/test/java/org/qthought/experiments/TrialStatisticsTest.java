package org.qthought.experiments;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class TrialStatisticsTest {

    @Test
    void recordsTrialsAndWins() {
        TrialStatistics statistics = new TrialStatistics(0, 0).record(true).record(false).record(false).record(true);

        assertThat(statistics.trials()).isEqualTo(4);
        assertThat(statistics.wins()).isEqualTo(2);
        assertThat(statistics.frequency()).isEqualTo(0.5);
        assertThat(statistics).hasToString("2/4 wins (0.5000)");
    }

    @Test
    void emptyStatisticsHaveZeroFrequency() {
        assertThat(new TrialStatistics(0, 0).frequency()).isZero();
        assertThatThrownBy(() -> new TrialStatistics(1, 2)).isInstanceOf(IllegalArgumentException.class);
    }
}
