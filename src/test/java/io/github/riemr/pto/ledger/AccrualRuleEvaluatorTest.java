package io.github.riemr.pto.ledger;

import io.github.riemr.pto.domain.model.AccrualFrequency;
import io.github.riemr.pto.domain.model.AccrualRule;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(OutputCaptureExtension.class)
class AccrualRuleEvaluatorTest {

    private final AccrualRuleEvaluator evaluator = new AccrualRuleEvaluator();

    private static AccrualRule rule(AccrualFrequency frequency, Integer anchorDay, LocalDate effective) {
        return AccrualRule.builder()
                .amount(BigDecimal.ONE)
                .frequency(frequency)
                .anchorDay(anchorDay)
                .effectiveDate(effective)
                .build();
    }

    @Test
    void daily_countsEveryDayIncludingTarget() {
        AccrualRule daily = rule(AccrualFrequency.DAILY, null, LocalDate.of(2024, 1, 1));
        assertThat(evaluator.accruedAsOf(daily, LocalDate.of(2024, 1, 10))).isEqualByComparingTo("10");
        assertThat(evaluator.accruedAsOf(daily, LocalDate.of(2023, 12, 31))).isEqualByComparingTo("0");
    }

    @Test
    void weekly_alignsToAnchorWeekday() {
        // effective on a Wednesday, accrues on Mondays
        AccrualRule weekly = rule(AccrualFrequency.WEEKLY, 1, LocalDate.of(2024, 1, 3));
        assertThat(evaluator.accruedAsOf(weekly, LocalDate.of(2024, 1, 7))).isEqualByComparingTo("0");
        assertThat(evaluator.accruedAsOf(weekly, LocalDate.of(2024, 1, 8))).isEqualByComparingTo("1");
        assertThat(evaluator.accruedAsOf(weekly, LocalDate.of(2024, 1, 14))).isEqualByComparingTo("1");
        assertThat(evaluator.accruedAsOf(weekly, LocalDate.of(2024, 1, 15))).isEqualByComparingTo("2");
    }

    @Test
    void biweekly_withoutAnchorStartsOnEffectiveDate() {
        AccrualRule biweekly = rule(AccrualFrequency.BIWEEKLY, null, LocalDate.of(2024, 1, 1));
        assertThat(evaluator.accruedAsOf(biweekly, LocalDate.of(2024, 1, 1))).isEqualByComparingTo("1");
        assertThat(evaluator.accruedAsOf(biweekly, LocalDate.of(2024, 1, 28))).isEqualByComparingTo("2");
        assertThat(evaluator.accruedAsOf(biweekly, LocalDate.of(2024, 1, 29))).isEqualByComparingTo("3");
    }

    @Test
    void monthly_anchor31_clampsToShortMonths() {
        AccrualRule monthly = rule(AccrualFrequency.MONTHLY, 31, LocalDate.of(2024, 2, 1));
        assertThat(evaluator.firstOccurrence(monthly)).isEqualTo(LocalDate.of(2024, 2, 29));
        assertThat(evaluator.accruedAsOf(monthly, LocalDate.of(2024, 2, 28))).isEqualByComparingTo("0");
        assertThat(evaluator.accruedAsOf(monthly, LocalDate.of(2024, 2, 29))).isEqualByComparingTo("1");
        assertThat(evaluator.accruedAsOf(monthly, LocalDate.of(2024, 3, 31))).isEqualByComparingTo("2");
        assertThat(evaluator.accruedAsOf(monthly, LocalDate.of(2024, 4, 29))).isEqualByComparingTo("2");
        assertThat(evaluator.accruedAsOf(monthly, LocalDate.of(2024, 4, 30))).isEqualByComparingTo("3");

        AccrualRule nonLeap = rule(AccrualFrequency.MONTHLY, 31, LocalDate.of(2023, 2, 1));
        assertThat(evaluator.firstOccurrence(nonLeap)).isEqualTo(LocalDate.of(2023, 2, 28));
    }

    @Test
    void monthly_withoutAnchorUsesEffectiveDayOfMonth() {
        AccrualRule monthly = rule(AccrualFrequency.MONTHLY, null, LocalDate.of(2024, 1, 31));
        // Jan 31, Feb 29, Mar 31
        assertThat(evaluator.accruedAsOf(monthly, LocalDate.of(2024, 3, 30))).isEqualByComparingTo("2");
        assertThat(evaluator.accruedAsOf(monthly, LocalDate.of(2024, 3, 31))).isEqualByComparingTo("3");
    }

    @Test
    void yearly_feb29FallsBackToFeb28() {
        AccrualRule yearly = rule(AccrualFrequency.YEARLY, null, LocalDate.of(2024, 2, 29));
        assertThat(evaluator.accruedAsOf(yearly, LocalDate.of(2025, 2, 27))).isEqualByComparingTo("1");
        assertThat(evaluator.accruedAsOf(yearly, LocalDate.of(2025, 2, 28))).isEqualByComparingTo("2");
        assertThat(evaluator.accruedAsOf(yearly, LocalDate.of(2026, 3, 1))).isEqualByComparingTo("3");
    }

    @Test
    void endDate_stopsAccrual() {
        AccrualRule daily = rule(AccrualFrequency.DAILY, null, LocalDate.of(2024, 1, 1)).toBuilder()
                .endDate(LocalDate.of(2024, 1, 5))
                .build();
        assertThat(evaluator.accruedAsOf(daily, LocalDate.of(2024, 1, 31))).isEqualByComparingTo("5");
    }

    @Test
    void inactiveRule_accruesNothing() {
        AccrualRule inactive = rule(AccrualFrequency.DAILY, null, LocalDate.of(2024, 1, 1)).toBuilder()
                .active(false)
                .build();
        assertThat(evaluator.accruedAsOf(inactive, LocalDate.of(2024, 1, 31))).isEqualByComparingTo("0");
    }

    @Test
    void accruedAsOf_isIdempotent() {
        AccrualRule monthly = rule(AccrualFrequency.MONTHLY, 15, LocalDate.of(2020, 1, 1)).toBuilder()
                .amount(new BigDecimal("1.25"))
                .build();
        LocalDate target = LocalDate.of(2024, 6, 30);
        BigDecimal first = evaluator.accruedAsOf(monthly, target);
        assertThat(evaluator.accruedAsOf(monthly, target)).isEqualByComparingTo(first);
        assertThat(first).isEqualByComparingTo("67.5");
    }

    @Test
    void runawayMonthlyRule_stopsAtIterationCapAndWarns(CapturedOutput output) {
        AccrualRule ancient = rule(AccrualFrequency.MONTHLY, 1, LocalDate.of(1000, 1, 1)).toBuilder()
                .amount(BigDecimal.ONE)
                .build();

        // 12,001 monthly grants through 2000-01-01; only the first 10,000 are counted
        assertThat(evaluator.accruedAsOf(ancient, LocalDate.of(2000, 1, 1)))
                .isEqualByComparingTo(String.valueOf(AccrualRuleEvaluator.MAX_ITERATIONS));
        assertThat(evaluator.accruedAsOf(ancient, LocalDate.of(2500, 1, 1)))
                .isEqualByComparingTo(String.valueOf(AccrualRuleEvaluator.MAX_ITERATIONS));
        assertThat(output).contains("Accrual iteration cap reached");
    }
}
