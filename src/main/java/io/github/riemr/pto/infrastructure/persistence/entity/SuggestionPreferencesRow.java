package io.github.riemr.pto.infrastructure.persistence.entity;

import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
public class SuggestionPreferencesRow {
    private String userId;
    private LocalDate earliestStart;
    private LocalDate latestEnd;
    private BigDecimal minPtoToKeep;
    private Integer minConsecutiveDaysOff;
    private Integer maxConsecutiveDaysOff;
    private Integer minSpacingBetweenBreaks;
    private String rankingMode;
    private Boolean extendExistingPto;
}
