package io.github.riemr.pto.application.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class HolidaySyncResult {
    String countryCode;
    int year;
    int fetched;
    int added;
    boolean replaced;
}
