package io.github.riemr.pto.domain.model;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Balance policy of one planner. Fields are nullable so partial values can be layered
 * (see {@code SettingsResolver}); the ledger only ever receives a resolved instance.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class LedgerSettings {
    private BigDecimal initialBalance;

    // tracking start; balance is 0 before this date
    private LocalDate asOfDate;

    @PositiveOrZero
    private BigDecimal carryOverLimit;

    // only month/day matter; resets happen every year on that day
    private LocalDate renewalDate;

    private BigDecimal maxBalance;

    private Boolean allowNegativeBalance;

    private DisplayUnit displayUnit;

    @Positive
    @DecimalMax("24")
    private BigDecimal hoursPerDay;

    public boolean hasCarryoverPolicy() {
        return carryOverLimit != null && renewalDate != null;
    }
}
