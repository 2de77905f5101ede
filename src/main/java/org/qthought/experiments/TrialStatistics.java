package org.qthought.experiments;

import java.util.Locale;

/**
 * Outcome counts of repeated trials.
 *
 * @param trials the number of trials run
 * @param wins   the number of trials meeting the winning condition
 */
public record TrialStatistics(long trials, long wins) {

    public TrialStatistics {
        if (trials < 0 || wins < 0 || wins > trials) {
            throw new IllegalArgumentException("Invalid statistics: " + wins + " wins in " + trials + " trials");
        }
    }

    /**
     * @return the fraction of winning trials, 0 if no trial ran.
     */
    public double frequency() {
        return trials == 0 ? 0.0 : (double) wins / trials;
    }

    /**
     * @param won whether the trial won.
     * @return the statistics including one more trial.
     */
    public TrialStatistics record(boolean won) {
        return new TrialStatistics(trials + 1, won ? wins + 1 : wins);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%d/%d wins (%.4f)", wins, trials, frequency());
    }
}
