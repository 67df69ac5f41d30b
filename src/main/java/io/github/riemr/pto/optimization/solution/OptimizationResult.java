package io.github.riemr.pto.optimization.solution;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@Value
@Builder
public class OptimizationResult {
    List<SuggestedBreak> breaks;
    List<LocalDate> suggestedDays;
    int totalPTOUsed;
    int totalDaysOff;
    double averageEfficiency;
    BigDecimal remainingPTO;

    public static OptimizationResult empty(BigDecimal remaining) {
        return OptimizationResult.builder()
                .breaks(List.of())
                .suggestedDays(List.of())
                .remainingPTO(remaining)
                .build();
    }

    public boolean isEmpty() {
        return breaks.isEmpty();
    }
}
