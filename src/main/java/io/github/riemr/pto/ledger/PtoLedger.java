package io.github.riemr.pto.ledger;

import io.github.riemr.pto.application.util.LocalDates;
import io.github.riemr.pto.domain.model.AccrualRule;
import io.github.riemr.pto.domain.model.DisplayUnit;
import io.github.riemr.pto.domain.model.LedgerSettings;
import io.github.riemr.pto.domain.model.TakenDay;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Balance-as-of-date over a {@link LedgerSnapshot}: initial balance, accruals, usage,
 * annual carryover forfeiture and the balance cap. Never clamps to zero except before
 * the tracking start date.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PtoLedger {

    private final AccrualRuleEvaluator evaluator;

    public BigDecimal balanceAsOf(LedgerSnapshot snapshot, LocalDate date) {
        return breakdownAsOf(snapshot, date).getBalance();
    }

    public BalanceBreakdown breakdownAsOf(LedgerSnapshot snapshot, LocalDate date) {
        LedgerSettings settings = snapshot.getSettings();
        DisplayUnit unit = unitOf(settings);
        LocalDate start = settings.getAsOfDate();
        if (start != null && date.isBefore(start)) {
            return BalanceBreakdown.beforeStart(date, unit);
        }

        BigDecimal initial = Optional.ofNullable(settings.getInitialBalance()).orElse(BigDecimal.ZERO);
        BigDecimal accrued = accruedAsOf(snapshot, date);
        BigDecimal used = usedBefore(snapshot, date);
        BigDecimal forfeited = forfeitedAsOf(snapshot, date);

        BigDecimal balance = initial.add(accrued).subtract(used).subtract(forfeited);
        boolean capped = false;
        if (settings.getMaxBalance() != null && balance.compareTo(settings.getMaxBalance()) > 0) {
            balance = settings.getMaxBalance();
            capped = true;
        }

        return BalanceBreakdown.builder()
                .asOf(date)
                .balance(balance)
                .initialBalance(initial)
                .accrued(accrued)
                .used(used)
                .forfeited(forfeited)
                .capped(capped)
                .displayUnit(unit)
                .build();
    }

    /** Sum of every active rule's accrual up to and including {@code date}. */
    public BigDecimal accruedAsOf(LedgerSnapshot snapshot, LocalDate date) {
        BigDecimal sum = BigDecimal.ZERO;
        for (AccrualRule rule : snapshot.getRules()) {
            if (!rule.isActive()) continue;
            sum = sum.add(evaluator.accruedAsOf(rule, date));
        }
        return sum;
    }

    /** Non-cancelled days strictly before {@code date}, in the display unit. */
    public BigDecimal usedBefore(LedgerSnapshot snapshot, LocalDate date) {
        long days = snapshot.getTakenDays().stream()
                .filter(TakenDay::consumesBudget)
                .filter(d -> d.getDate() != null && d.getDate().isBefore(date))
                .count();
        BigDecimal used = BigDecimal.valueOf(days);
        LedgerSettings settings = snapshot.getSettings();
        if (unitOf(settings) == DisplayUnit.HOURS) {
            used = used.multiply(hoursPerDay(settings));
        }
        return used;
    }

    /**
     * Total forfeited by the annual resets up to {@code date}. Each reset depends on the
     * previous ones, so they are applied in calendar order.
     */
    public BigDecimal forfeitedAsOf(LedgerSnapshot snapshot, LocalDate date) {
        LedgerSettings settings = snapshot.getSettings();
        if (!settings.hasCarryoverPolicy()) {
            if (settings.getCarryOverLimit() != null) {
                log.debug("carryOverLimit set without renewalDate; no resets applied");
            }
            return BigDecimal.ZERO;
        }
        BigDecimal limit = settings.getCarryOverLimit().max(BigDecimal.ZERO);
        BigDecimal initial = Optional.ofNullable(settings.getInitialBalance()).orElse(BigDecimal.ZERO);
        BigDecimal forfeited = BigDecimal.ZERO;

        for (LocalDate reset : resetDates(settings, date)) {
            // grants dated on the reset day are counted before the limit applies
            BigDecimal before = initial
                    .add(accruedAsOf(snapshot, reset))
                    .subtract(usedBefore(snapshot, reset))
                    .subtract(forfeited);
            BigDecimal allowed = limit.min(before.max(BigDecimal.ZERO));
            if (before.compareTo(allowed) > 0) {
                forfeited = forfeited.add(before.subtract(allowed));
            }
        }
        return forfeited;
    }

    /** Anniversaries of the renewal date that are on/before {@code date} and after the tracking start. */
    List<LocalDate> resetDates(LedgerSettings settings, LocalDate date) {
        List<LocalDate> resets = new ArrayList<>();
        LocalDate renewal = settings.getRenewalDate();
        LocalDate start = settings.getAsOfDate();
        for (int year = renewal.getYear(); year <= date.getYear(); year++) {
            LocalDate candidate = LocalDates.sameDayInYear(renewal, year);
            if (candidate.isAfter(date)) break;
            if (start == null || candidate.isAfter(start)) {
                resets.add(candidate);
            }
        }
        return resets;
    }

    /** Ledger amount expressed in PTO days; hours are converted with {@code hoursPerDay}. */
    public BigDecimal toDays(BigDecimal amount, LedgerSettings settings) {
        if (amount == null) return BigDecimal.ZERO;
        if (unitOf(settings) == DisplayUnit.HOURS) {
            return amount.divide(hoursPerDay(settings), 3, RoundingMode.HALF_UP);
        }
        return amount;
    }

    private static DisplayUnit unitOf(LedgerSettings settings) {
        return settings.getDisplayUnit() != null ? settings.getDisplayUnit() : DisplayUnit.DAYS;
    }

    private static BigDecimal hoursPerDay(LedgerSettings settings) {
        BigDecimal hours = settings.getHoursPerDay();
        return hours != null && hours.signum() > 0 ? hours : BigDecimal.valueOf(8);
    }
}
