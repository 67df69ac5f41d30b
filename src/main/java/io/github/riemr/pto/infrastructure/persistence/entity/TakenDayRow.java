package io.github.riemr.pto.infrastructure.persistence.entity;

import lombok.Data;

import java.time.LocalDate;

@Data
public class TakenDayRow {
    private Long takenDayId;
    private String userId;
    private LocalDate dayDate;
    private String status;
    private String description;
}
