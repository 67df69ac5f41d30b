package io.github.riemr.pto.optimization.phase;

import io.github.riemr.pto.optimization.entity.AnchorSource;
import io.github.riemr.pto.optimization.entity.OffDayCalendar;
import io.github.riemr.pto.optimization.entity.Segment;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Splits the search window into alternating working / non-working segments.
 * Existing PTO days are always non-working: they can never be bought again.
 */
public final class TimelineBuilder {
    private TimelineBuilder() {}

    public static List<Segment> build(LocalDate start, LocalDate end, OffDayCalendar calendar, Set<LocalDate> existingPto) {
        List<Segment> segments = new ArrayList<>();
        Segment current = null;
        for (LocalDate day = start; !day.isAfter(end); day = day.plusDays(1)) {
            Set<AnchorSource> sources = EnumSet.noneOf(AnchorSource.class);
            if (calendar.isWeekend(day)) sources.add(AnchorSource.WEEKEND);
            if (calendar.isHoliday(day)) sources.add(AnchorSource.HOLIDAY);
            if (existingPto.contains(day)) sources.add(AnchorSource.EXISTING);
            boolean working = sources.isEmpty();

            if (current == null || current.isWorking() != working) {
                current = new Segment(working);
                segments.add(current);
            }
            current.add(day, sources);
        }
        return segments;
    }
}
