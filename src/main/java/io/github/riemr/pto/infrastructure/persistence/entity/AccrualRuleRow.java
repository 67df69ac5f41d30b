package io.github.riemr.pto.infrastructure.persistence.entity;

import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
public class AccrualRuleRow {
    private Long ruleId;
    private String userId;
    private String name;
    private BigDecimal amount;
    private String frequency;
    private Integer anchorDay;
    private LocalDate effectiveDate;
    private LocalDate endDate;
    private Boolean active;
}
