package io.github.riemr.pto.optimization.service;

import io.github.riemr.pto.domain.model.SuggestionPreferences;
import io.github.riemr.pto.optimization.constraint.BreakRanking;
import io.github.riemr.pto.optimization.constraint.BreakSpacing;
import io.github.riemr.pto.optimization.entity.OffDayCalendar;
import io.github.riemr.pto.optimization.entity.Segment;
import io.github.riemr.pto.optimization.phase.CandidateBreakBuilder;
import io.github.riemr.pto.optimization.phase.TimelineBuilder;
import io.github.riemr.pto.optimization.solution.OptimizationResult;
import io.github.riemr.pto.optimization.solution.SuggestedBreak;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Greedy gap-filling search for PTO breaks.
 *
 * <p>Working-day gaps between weekends/holidays become candidates, candidates outside the
 * preference bounds are dropped, the rest are ranked and accepted in order while budget
 * and spacing allow. Holds no mutable state; safe to share.
 */
@Slf4j
public class BreakSuggestionOptimizer {

    private final int mergeGapLimit;

    public BreakSuggestionOptimizer(int mergeGapLimit) {
        this.mergeGapLimit = mergeGapLimit;
    }

    public OptimizationResult suggest(BigDecimal budget, Set<LocalDate> nonWorkingDays,
                                      Set<LocalDate> existingPto, SuggestionPreferences prefs) {
        return suggest(budget, OffDayCalendar.ofDates(nonWorkingDays), existingPto, prefs);
    }

    public OptimizationResult suggest(BigDecimal budget, OffDayCalendar calendar,
                                      Set<LocalDate> existingPto, SuggestionPreferences prefs) {
        BigDecimal total = budget == null ? BigDecimal.ZERO : budget;
        LocalDate start = prefs.getEarliestStart();
        LocalDate end = prefs.getLatestEnd();
        if (start == null || end == null || start.isAfter(end)
                || prefs.getMinConsecutiveDaysOff() > prefs.getMaxConsecutiveDaysOff()) {
            return OptimizationResult.empty(total);
        }

        int spendable = spendable(total, prefs.getMinPTOToKeep());
        if (spendable <= 0) {
            log.debug("No spendable PTO: budget={}, reserve={}", total, prefs.getMinPTOToKeep());
            return OptimizationResult.empty(total);
        }

        List<Segment> timeline = TimelineBuilder.build(start, end, calendar, existingPto == null ? Set.of() : existingPto);
        List<SuggestedBreak> candidates = new CandidateBreakBuilder(timeline, start, end,
                prefs.isExtendExistingPTO(), mergeGapLimit)
                .build(spendable, prefs.getMaxConsecutiveDaysOff())
                .stream()
                .filter(c -> c.getTotalDaysOff() >= prefs.getMinConsecutiveDaysOff())
                .filter(c -> c.getTotalDaysOff() <= prefs.getMaxConsecutiveDaysOff())
                .filter(c -> c.getPtoRequired() <= spendable)
                .sorted(BreakRanking.comparator(prefs.getRankingMode()))
                .collect(Collectors.toList());

        List<SuggestedBreak> accepted = new ArrayList<>();
        int remaining = spendable;
        for (SuggestedBreak candidate : candidates) {
            if (candidate.getPtoRequired() > remaining) continue;
            if (BreakSpacing.conflicts(candidate, accepted, prefs.getMinSpacingBetweenBreaks())) continue;
            accepted.add(candidate);
            remaining -= candidate.getPtoRequired();
        }
        log.debug("Break search: segments={}, candidates={}, accepted={}, spendable={}",
                timeline.size(), candidates.size(), accepted.size(), spendable);
        return aggregate(accepted, total);
    }

    static int spendable(BigDecimal budget, BigDecimal reserve) {
        BigDecimal keep = reserve == null ? BigDecimal.ZERO : reserve.max(BigDecimal.ZERO);
        BigDecimal free = budget.subtract(keep);
        if (free.signum() <= 0) return 0;
        return free.setScale(0, RoundingMode.FLOOR).min(BigDecimal.valueOf(Integer.MAX_VALUE)).intValueExact();
    }

    private static OptimizationResult aggregate(List<SuggestedBreak> accepted, BigDecimal budget) {
        if (accepted.isEmpty()) return OptimizationResult.empty(budget);
        TreeSet<LocalDate> days = new TreeSet<>();
        int ptoUsed = 0;
        int daysOff = 0;
        for (SuggestedBreak b : accepted) {
            days.addAll(b.getPtoDays());
            ptoUsed += b.getPtoRequired();
            daysOff += b.getTotalDaysOff();
        }
        return OptimizationResult.builder()
                .breaks(List.copyOf(accepted))
                .suggestedDays(List.copyOf(days))
                .totalPTOUsed(ptoUsed)
                .totalDaysOff(daysOff)
                .averageEfficiency(ptoUsed > 0 ? (double) daysOff / ptoUsed : 0d)
                .remainingPTO(budget.subtract(BigDecimal.valueOf(ptoUsed)))
                .build();
    }
}
