package io.github.riemr.pto.infrastructure.persistence.entity;

import lombok.Data;

import java.time.LocalDate;

@Data
public class HolidayRow {
    private Long holidayId;
    private String userId;
    private String name;
    private LocalDate holidayDate;
    private Boolean repeatsYearly;
    private Boolean paid;
    private String countryCode;
}
