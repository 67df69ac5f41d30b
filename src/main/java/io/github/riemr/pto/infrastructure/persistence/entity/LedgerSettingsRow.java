package io.github.riemr.pto.infrastructure.persistence.entity;

import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
public class LedgerSettingsRow {
    private String userId;
    private BigDecimal initialBalance;
    private LocalDate asOfDate;
    private BigDecimal carryOverLimit;
    private LocalDate renewalDate;
    private BigDecimal maxBalance;
    private Boolean allowNegativeBalance;
    private String displayUnit; // DAYS or HOURS
    private BigDecimal hoursPerDay;
}
