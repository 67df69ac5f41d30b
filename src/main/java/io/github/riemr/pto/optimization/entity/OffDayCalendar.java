package io.github.riemr.pto.optimization.entity;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Set;

/**
 * Non-working days known up front: weekly weekend days plus dated holidays.
 */
public final class OffDayCalendar {
    public static final Set<DayOfWeek> DEFAULT_WEEKEND = EnumSet.of(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY);

    private final Set<DayOfWeek> weekendDays;
    private final Set<LocalDate> weekendDates;
    private final Set<LocalDate> holidays;

    private OffDayCalendar(Set<DayOfWeek> weekendDays, Set<LocalDate> weekendDates, Set<LocalDate> holidays) {
        this.weekendDays = weekendDays;
        this.weekendDates = weekendDates;
        this.holidays = holidays;
    }

    public static OffDayCalendar of(Set<DayOfWeek> weekendDays, Set<LocalDate> holidays) {
        Set<DayOfWeek> days = weekendDays == null || weekendDays.isEmpty()
                ? EnumSet.noneOf(DayOfWeek.class)
                : EnumSet.copyOf(weekendDays);
        return new OffDayCalendar(days, Set.of(), holidays == null ? Set.of() : Set.copyOf(holidays));
    }

    /**
     * Builds a calendar from a flat set of non-working dates. Saturdays and Sundays in the
     * set are labelled as weekend, everything else as holiday.
     */
    public static OffDayCalendar ofDates(Set<LocalDate> nonWorkingDays) {
        Set<LocalDate> weekend = new HashSet<>();
        Set<LocalDate> other = new HashSet<>();
        if (nonWorkingDays != null) {
            for (LocalDate d : nonWorkingDays) {
                if (DEFAULT_WEEKEND.contains(d.getDayOfWeek())) weekend.add(d);
                else other.add(d);
            }
        }
        return new OffDayCalendar(EnumSet.noneOf(DayOfWeek.class), weekend, other);
    }

    public boolean isWeekend(LocalDate date) {
        return weekendDays.contains(date.getDayOfWeek()) || weekendDates.contains(date);
    }

    public boolean isHoliday(LocalDate date) {
        return holidays.contains(date);
    }
}
