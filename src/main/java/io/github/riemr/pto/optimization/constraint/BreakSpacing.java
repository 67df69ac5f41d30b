package io.github.riemr.pto.optimization.constraint;

import io.github.riemr.pto.optimization.solution.SuggestedBreak;

import java.time.LocalDate;
import java.util.Collection;

public final class BreakSpacing {
    private BreakSpacing() {}

    /**
     * True when {@code candidate} starts or ends within {@code minSpacing} days of any accepted break
     * (overlap included). The later break must start at least {@code minSpacing + 1} days after the
     * earlier one ends.
     */
    public static boolean conflicts(SuggestedBreak candidate, Collection<SuggestedBreak> accepted, int minSpacing) {
        int spacing = Math.max(0, minSpacing);
        for (SuggestedBreak other : accepted) {
            SuggestedBreak first = !candidate.getStart().isAfter(other.getStart()) ? candidate : other;
            SuggestedBreak second = first == candidate ? other : candidate;
            LocalDate earliestNextStart = first.getEnd().plusDays(spacing + 1L);
            if (second.getStart().isBefore(earliestNextStart)) return true;
        }
        return false;
    }
}
