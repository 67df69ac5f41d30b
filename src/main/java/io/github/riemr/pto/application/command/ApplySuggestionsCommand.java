package io.github.riemr.pto.application.command;

import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * Stores the chosen suggested dates as planned PTO.
 */
@Value
public class ApplySuggestionsCommand {
    String userId;
    List<LocalDate> dates;
}
