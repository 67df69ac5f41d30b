package io.github.riemr.pto.infrastructure.persistence.entity;

import lombok.Data;

@Data
public class WeekendConfigRow {
    private String userId;
    private String weekendDays; // comma separated 0..6, 0 = Sunday
}
