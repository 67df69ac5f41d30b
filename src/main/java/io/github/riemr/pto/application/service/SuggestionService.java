package io.github.riemr.pto.application.service;

import io.github.riemr.pto.domain.model.Holiday;
import io.github.riemr.pto.domain.model.SuggestionPreferences;
import io.github.riemr.pto.domain.model.TakenDay;
import io.github.riemr.pto.ledger.LedgerSnapshot;
import io.github.riemr.pto.optimization.entity.OffDayCalendar;
import io.github.riemr.pto.optimization.service.BreakSuggestionOptimizer;
import io.github.riemr.pto.optimization.solution.OptimizationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Gathers the optimizer inputs for a user (budget, off days, existing PTO) and runs it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SuggestionService {
    private final SuggestionPreferenceService preferenceService;
    private final LedgerService ledgerService;
    private final HolidayService holidayService;
    private final WeekendService weekendService;
    private final BreakSuggestionOptimizer optimizer;
    private final Clock clock;

    public OptimizationResult suggest(String userId, Optional<SuggestionPreferences> override) {
        SuggestionPreferences prefs = override.isPresent()
                ? preferenceService.validate(override.get())
                : preferenceService.load(userId);

        LocalDate today = LocalDate.now(clock);
        LocalDate start = prefs.getEarliestStart().isBefore(today) ? today : prefs.getEarliestStart();
        LocalDate end = prefs.getLatestEnd();
        LedgerSnapshot snapshot = ledgerService.snapshot(userId, Optional.empty());
        BigDecimal budget = ledgerService.availableDays(snapshot, end);
        if (end.isBefore(start)) {
            log.debug("Suggestion window already over: userId={}, latestEnd={}", userId, end);
            return OptimizationResult.empty(budget);
        }
        SuggestionPreferences window = prefs.toBuilder().earliestStart(start).build();

        Set<LocalDate> holidays = HolidayService.expand(
                holidayService.list(userId).stream().filter(Holiday::isPaid).collect(Collectors.toList()),
                start, end);
        Set<LocalDate> existing = snapshot.getTakenDays().stream()
                .filter(TakenDay::consumesBudget)
                .map(TakenDay::getDate)
                .collect(Collectors.toSet());
        OffDayCalendar calendar = OffDayCalendar.of(weekendService.getWeekendDays(userId), holidays);

        OptimizationResult result = optimizer.suggest(budget, calendar, existing, window);
        log.debug("Suggestions generated: userId={}, window={}..{}, budget={}, breaks={}",
                userId, start, end, budget, result.getBreaks().size());
        return result;
    }
}
