package io.github.riemr.pto.ledger;

import io.github.riemr.pto.domain.model.DisplayUnit;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Components of a balance in the configured display unit.
 * {@code balance == initialBalance + accrued - used - forfeited}, then capped by the max balance.
 */
@Value
@Builder
public class BalanceBreakdown {
    LocalDate asOf;
    BigDecimal balance;
    BigDecimal initialBalance;
    BigDecimal accrued;
    BigDecimal used;
    BigDecimal forfeited;
    boolean capped;
    boolean beforeTrackingStart;
    DisplayUnit displayUnit;

    public static BalanceBreakdown beforeStart(LocalDate asOf, DisplayUnit unit) {
        return BalanceBreakdown.builder()
                .asOf(asOf)
                .balance(BigDecimal.ZERO)
                .initialBalance(BigDecimal.ZERO)
                .accrued(BigDecimal.ZERO)
                .used(BigDecimal.ZERO)
                .forfeited(BigDecimal.ZERO)
                .beforeTrackingStart(true)
                .displayUnit(unit)
                .build();
    }
}
