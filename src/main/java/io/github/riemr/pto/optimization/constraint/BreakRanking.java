package io.github.riemr.pto.optimization.constraint;

import io.github.riemr.pto.domain.model.RankingMode;
import io.github.riemr.pto.optimization.solution.SuggestedBreak;

import java.util.Comparator;

/**
 * Candidate orderings per ranking mode. Every ordering ends on the start date so the
 * result is deterministic.
 */
public final class BreakRanking {
    private static final Comparator<SuggestedBreak> BY_START = Comparator.comparing(SuggestedBreak::getStart);
    private static final Comparator<SuggestedBreak> BY_EFFICIENCY_DESC =
            Comparator.comparingDouble(SuggestedBreak::getEfficiency).reversed();

    private BreakRanking() {}

    public static Comparator<SuggestedBreak> comparator(RankingMode mode) {
        if (mode == null) mode = RankingMode.EFFICIENCY;
        switch (mode) {
            case LONGEST:
                return Comparator.comparingInt(SuggestedBreak::getTotalDaysOff).reversed()
                        .thenComparing(BY_EFFICIENCY_DESC)
                        .thenComparing(BY_START);
            case LEAST_PTO:
                return Comparator.comparingInt(SuggestedBreak::getPtoRequired)
                        .thenComparing(BY_EFFICIENCY_DESC)
                        .thenComparing(BY_START);
            case EARLIEST:
                return BY_START
                        .thenComparing(Comparator.comparingInt(SuggestedBreak::getTotalDaysOff).reversed())
                        .thenComparingInt(SuggestedBreak::getPtoRequired);
            case EFFICIENCY:
            default:
                return BY_EFFICIENCY_DESC
                        .thenComparing(BY_START)
                        .thenComparingInt(SuggestedBreak::getPtoRequired);
        }
    }
}
