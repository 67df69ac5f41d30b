package io.github.riemr.pto.ledger;

import io.github.riemr.pto.domain.model.AccrualFrequency;
import io.github.riemr.pto.domain.model.AccrualRule;
import io.github.riemr.pto.domain.model.DisplayUnit;
import io.github.riemr.pto.domain.model.LedgerSettings;
import io.github.riemr.pto.domain.model.TakenDay;
import io.github.riemr.pto.domain.model.TakenDayStatus;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class PtoLedgerTest {

    private static final LocalDate START = LocalDate.of(2024, 1, 1);

    private final PtoLedger ledger = new PtoLedger(new AccrualRuleEvaluator());

    private static LedgerSettings.LedgerSettingsBuilder settings(String initial) {
        return LedgerSettings.builder()
                .initialBalance(new BigDecimal(initial))
                .asOfDate(START)
                .displayUnit(DisplayUnit.DAYS);
    }

    private static TakenDay day(LocalDate date, TakenDayStatus status) {
        return TakenDay.builder().date(date).status(status).build();
    }

    @Test
    void balanceBeforeTrackingStart_isZero() {
        LedgerSnapshot snapshot = LedgerSnapshot.builder().settings(settings("10").build()).build();

        BalanceBreakdown breakdown = ledger.breakdownAsOf(snapshot, START.minusDays(1));

        assertThat(breakdown.getBalance()).isEqualByComparingTo("0");
        assertThat(breakdown.isBeforeTrackingStart()).isTrue();
        assertThat(ledger.balanceAsOf(snapshot, START)).isEqualByComparingTo("10");
    }

    @Test
    void usedDays_countOnlyStrictlyBeforeDateAndSkipCancelled() {
        LedgerSnapshot snapshot = LedgerSnapshot.builder()
                .settings(settings("10").build())
                .takenDay(day(LocalDate.of(2024, 3, 5), TakenDayStatus.PLANNED))
                .takenDay(day(LocalDate.of(2024, 3, 6), TakenDayStatus.CANCELLED))
                .build();

        assertThat(ledger.balanceAsOf(snapshot, LocalDate.of(2024, 3, 5))).isEqualByComparingTo("10");
        assertThat(ledger.balanceAsOf(snapshot, LocalDate.of(2024, 3, 6))).isEqualByComparingTo("9");
        assertThat(ledger.balanceAsOf(snapshot, LocalDate.of(2024, 3, 7))).isEqualByComparingTo("9");
    }

    @Test
    void carryover_forfeitsAboveLimitOnRenewal() {
        LedgerSnapshot snapshot = LedgerSnapshot.builder()
                .settings(settings("80")
                        .carryOverLimit(new BigDecimal("40"))
                        .renewalDate(LocalDate.of(2025, 1, 1))
                        .build())
                .build();

        assertThat(ledger.balanceAsOf(snapshot, LocalDate.of(2024, 12, 31))).isEqualByComparingTo("80");
        BalanceBreakdown after = ledger.breakdownAsOf(snapshot, LocalDate.of(2025, 1, 2));
        assertThat(after.getBalance()).isEqualByComparingTo("40");
        assertThat(after.getForfeited()).isEqualByComparingTo("40");
    }

    @Test
    void carryover_capsGrantDatedOnResetDay() {
        AccrualRule monthly = AccrualRule.builder()
                .amount(BigDecimal.ONE)
                .frequency(AccrualFrequency.MONTHLY)
                .anchorDay(1)
                .effectiveDate(START)
                .build();
        LedgerSnapshot snapshot = LedgerSnapshot.builder()
                .settings(settings("0")
                        .carryOverLimit(new BigDecimal("5"))
                        .renewalDate(LocalDate.of(2025, 1, 1))
                        .build())
                .rule(monthly)
                .build();

        // 12 grants in 2024 plus the Jan 1 2025 grant, capped to 5 at the reset
        assertThat(ledger.balanceAsOf(snapshot, LocalDate.of(2025, 1, 1))).isEqualByComparingTo("5");
        assertThat(ledger.balanceAsOf(snapshot, LocalDate.of(2025, 1, 2))).isEqualByComparingTo("5");
        assertThat(ledger.balanceAsOf(snapshot, LocalDate.of(2025, 2, 1))).isEqualByComparingTo("6");
    }

    @Test
    void maxBalance_capsTheResult() {
        AccrualRule daily = AccrualRule.builder()
                .amount(BigDecimal.ONE)
                .frequency(AccrualFrequency.DAILY)
                .effectiveDate(START)
                .build();
        LedgerSnapshot snapshot = LedgerSnapshot.builder()
                .settings(settings("10").maxBalance(new BigDecimal("20")).build())
                .rule(daily)
                .build();

        BalanceBreakdown breakdown = ledger.breakdownAsOf(snapshot, LocalDate.of(2024, 1, 31));

        assertThat(breakdown.getBalance()).isEqualByComparingTo("20");
        assertThat(breakdown.isCapped()).isTrue();
        assertThat(breakdown.getAccrued()).isEqualByComparingTo("31");
    }

    @Test
    void negativeBalance_isNotClamped() {
        LedgerSnapshot snapshot = LedgerSnapshot.builder()
                .settings(settings("1").build())
                .takenDay(day(LocalDate.of(2024, 2, 1), TakenDayStatus.TAKEN))
                .takenDay(day(LocalDate.of(2024, 2, 2), TakenDayStatus.TAKEN))
                .build();

        assertThat(ledger.balanceAsOf(snapshot, LocalDate.of(2024, 3, 1))).isEqualByComparingTo("-1");
    }

    @Test
    void hoursUnit_chargesHoursPerDayAndConvertsBack() {
        LedgerSettings hours = settings("80")
                .displayUnit(DisplayUnit.HOURS)
                .hoursPerDay(new BigDecimal("8"))
                .build();
        LedgerSnapshot snapshot = LedgerSnapshot.builder()
                .settings(hours)
                .takenDay(day(LocalDate.of(2024, 2, 1), TakenDayStatus.APPROVED))
                .build();

        BigDecimal balance = ledger.balanceAsOf(snapshot, LocalDate.of(2024, 2, 2));

        assertThat(balance).isEqualByComparingTo("72");
        assertThat(ledger.toDays(balance, hours)).isEqualByComparingTo("9");
    }

    @Test
    void withoutRuleActivity_balanceOnlyDropsByUsage() {
        LedgerSnapshot snapshot = LedgerSnapshot.builder()
                .settings(settings("15").build())
                .takenDay(day(LocalDate.of(2024, 4, 10), TakenDayStatus.PLANNED))
                .takenDay(day(LocalDate.of(2024, 4, 11), TakenDayStatus.PLANNED))
                .build();
        LocalDate d1 = LocalDate.of(2024, 4, 1);
        LocalDate d2 = LocalDate.of(2024, 5, 1);
        BigDecimal usedBetween = ledger.usedBefore(snapshot, d2).subtract(ledger.usedBefore(snapshot, d1));

        assertThat(ledger.balanceAsOf(snapshot, d2))
                .isGreaterThanOrEqualTo(ledger.balanceAsOf(snapshot, d1).subtract(usedBetween));
    }

    @Test
    void resetDates_skipAnniversariesOnOrBeforeTrackingStart() {
        LedgerSettings s = settings("0")
                .carryOverLimit(BigDecimal.ZERO)
                .renewalDate(LocalDate.of(2023, 1, 1))
                .build();

        assertThat(ledger.resetDates(s, LocalDate.of(2026, 6, 1)))
                .containsExactly(LocalDate.of(2025, 1, 1), LocalDate.of(2026, 1, 1));
    }
}
