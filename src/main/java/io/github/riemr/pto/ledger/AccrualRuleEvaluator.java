package io.github.riemr.pto.ledger;

import io.github.riemr.pto.application.util.LocalDates;
import io.github.riemr.pto.domain.model.AccrualFrequency;
import io.github.riemr.pto.domain.model.AccrualRule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;

/**
 * Computes how much a single accrual rule has granted up to and including a date.
 * Stateless: the same rule and date always give the same amount.
 */
@Component
@Slf4j
public class AccrualRuleEvaluator {

    /** Upper bound on stepped occurrences; reaching it means the rule is misconfigured. */
    static final int MAX_ITERATIONS = 10_000;

    public BigDecimal accruedAsOf(AccrualRule rule, LocalDate targetDate) {
        if (rule == null || targetDate == null || !rule.isActive()) return BigDecimal.ZERO;
        LocalDate effective = rule.getEffectiveDate();
        if (effective == null || rule.getAmount() == null || rule.getFrequency() == null) return BigDecimal.ZERO;
        if (targetDate.isBefore(effective)) return BigDecimal.ZERO;

        LocalDate limit = rule.getEndDate() != null && rule.getEndDate().isBefore(targetDate)
                ? rule.getEndDate()
                : targetDate;
        LocalDate first = firstOccurrence(rule);
        if (first.isAfter(limit)) return BigDecimal.ZERO;

        long occurrences = rule.getFrequency().hasFixedPeriod()
                ? countFixedPeriod(first, limit, rule.getFrequency().getPeriodDays())
                : countCalendarPeriod(rule, first, limit);
        return rule.getAmount().multiply(BigDecimal.valueOf(occurrences));
    }

    LocalDate firstOccurrence(AccrualRule rule) {
        LocalDate effective = rule.getEffectiveDate();
        Integer anchor = rule.getAnchorDay();
        switch (rule.getFrequency()) {
            case WEEKLY:
            case BIWEEKLY:
                return anchor == null ? effective : LocalDates.alignToDayOfWeek(effective, anchor);
            case MONTHLY: {
                int dom = anchor != null ? anchor : effective.getDayOfMonth();
                LocalDate candidate = LocalDates.clampDayOfMonth(YearMonth.from(effective), dom);
                if (candidate.isBefore(effective)) {
                    candidate = LocalDates.clampDayOfMonth(YearMonth.from(effective).plusMonths(1), dom);
                }
                return candidate;
            }
            case YEARLY: {
                LocalDate candidate = yearlyOccurrence(rule, effective.getYear());
                if (candidate.isBefore(effective)) {
                    candidate = yearlyOccurrence(rule, effective.getYear() + 1);
                }
                return candidate;
            }
            case DAILY:
            default:
                return effective;
        }
    }

    private long countFixedPeriod(LocalDate first, LocalDate limit, int periodDays) {
        long elapsed = ChronoUnit.DAYS.between(first, limit);
        return elapsed / periodDays + 1;
    }

    private long countCalendarPeriod(AccrualRule rule, LocalDate first, LocalDate limit) {
        AccrualFrequency frequency = rule.getFrequency();
        int monthlyDay = rule.getAnchorDay() != null ? rule.getAnchorDay() : rule.getEffectiveDate().getDayOfMonth();
        YearMonth month = YearMonth.from(first);
        int year = first.getYear();
        LocalDate occurrence = first;
        long count = 0;
        while (!occurrence.isAfter(limit)) {
            count++;
            if (count >= MAX_ITERATIONS) {
                log.warn("Accrual iteration cap reached: ruleId={}, frequency={}, effectiveDate={}, target={}",
                        rule.getId(), frequency, rule.getEffectiveDate(), limit);
                break;
            }
            if (frequency == AccrualFrequency.MONTHLY) {
                month = month.plusMonths(1);
                occurrence = LocalDates.clampDayOfMonth(month, monthlyDay);
            } else {
                year++;
                occurrence = yearlyOccurrence(rule, year);
            }
        }
        return count;
    }

    private LocalDate yearlyOccurrence(AccrualRule rule, int year) {
        Integer anchor = rule.getAnchorDay();
        if (anchor != null) return LocalDates.clampDayOfYear(year, anchor);
        return LocalDates.sameDayInYear(rule.getEffectiveDate(), year);
    }
}
