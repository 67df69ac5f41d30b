package io.github.riemr.pto.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Knobs of the break optimizer. Validated before use; invalid pairs are rejected, not clamped.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SuggestionPreferences {
    @NotNull
    private LocalDate earliestStart;

    @NotNull
    private LocalDate latestEnd;

    @NotNull
    @PositiveOrZero
    private BigDecimal minPTOToKeep;

    @Min(1)
    private int minConsecutiveDaysOff;

    @Min(1)
    private int maxConsecutiveDaysOff;

    @PositiveOrZero
    private int minSpacingBetweenBreaks;

    @NotNull
    private RankingMode rankingMode;

    private boolean extendExistingPTO;

    @JsonIgnore
    @AssertTrue(message = "minConsecutiveDaysOff must not exceed maxConsecutiveDaysOff")
    public boolean isDaysOffRangeValid() {
        return minConsecutiveDaysOff <= maxConsecutiveDaysOff;
    }

    @JsonIgnore
    @AssertTrue(message = "earliestStart must not be after latestEnd")
    public boolean isWindowValid() {
        return earliestStart == null || latestEnd == null || !earliestStart.isAfter(latestEnd);
    }
}
