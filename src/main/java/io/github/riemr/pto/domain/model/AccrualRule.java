package io.github.riemr.pto.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Recurring PTO grant. Rules are deactivated instead of deleted so past balances keep their history.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AccrualRule {
    private Long id;

    @Size(max = 100)
    private String name;

    @NotNull
    @Positive
    private BigDecimal amount;

    @NotNull
    private AccrualFrequency frequency;

    // weekday 0..6 for WEEKLY/BIWEEKLY, day-of-month for MONTHLY, day-of-year for YEARLY
    private Integer anchorDay;

    @NotNull
    private LocalDate effectiveDate;

    private LocalDate endDate;

    @Builder.Default
    private boolean active = true;

    @JsonIgnore
    @AssertTrue(message = "endDate must not be before effectiveDate")
    public boolean isEndDateConsistent() {
        return endDate == null || effectiveDate == null || !endDate.isBefore(effectiveDate);
    }

    @JsonIgnore
    @AssertTrue(message = "anchorDay is out of range for the accrual frequency")
    public boolean isAnchorDayConsistent() {
        return frequency == null || frequency.isAnchorDayValid(anchorDay);
    }
}
