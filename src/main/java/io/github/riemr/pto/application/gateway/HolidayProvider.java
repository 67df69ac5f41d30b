package io.github.riemr.pto.application.gateway;

import io.github.riemr.pto.domain.model.Holiday;

import java.util.List;

public interface HolidayProvider {
    /**
     * Public holidays of one calendar year. Imported holidays never repeat yearly,
     * since observed dates move between years.
     */
    List<Holiday> fetchHolidays(String countryCode, int year);
}
