package io.github.riemr.pto.application.util;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.Year;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Objects;

/**
 * Date-only helpers. Every value handled here is a calendar date with no time
 * or zone attached, so a date never moves across a midnight boundary.
 */
public final class LocalDates {
    private static final DateTimeFormatter LOCAL_DATE = DateTimeFormatter.ISO_LOCAL_DATE;

    private LocalDates() {}

    public static String formatLocal(LocalDate date) {
        Objects.requireNonNull(date, "date");
        return date.format(LOCAL_DATE);
    }

    public static LocalDate parseLocal(String value) {
        if (value == null || value.isBlank()) throw new IllegalArgumentException("date is required");
        try {
            return LocalDate.parse(value.trim(), LOCAL_DATE);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Expected YYYY-MM-DD but got: " + value, e);
        }
    }

    /**
     * Converts a legacy {@link Date} (e.g. a JDBC value) using the given zone.
     * Going through {@code toInstant().toString()} would shift the day for zones west of UTC.
     */
    public static LocalDate toLocalDate(Date date, ZoneId zone) {
        if (date == null) return null;
        if (date instanceof java.sql.Date sqlDate) return sqlDate.toLocalDate();
        return date.toInstant().atZone(zone).toLocalDate();
    }

    public static boolean isSameDay(LocalDate a, LocalDate b) {
        return a != null && a.equals(b);
    }

    public static boolean matchesHoliday(LocalDate date, LocalDate holidayDate, boolean repeatsYearly) {
        if (date == null || holidayDate == null) return false;
        if (repeatsYearly) {
            return date.getMonth() == holidayDate.getMonth()
                    && date.getDayOfMonth() == holidayDate.getDayOfMonth();
        }
        return date.equals(holidayDate);
    }

    /** 0 = Sunday .. 6 = Saturday. */
    public static DayOfWeek dayOfWeekFromIndex(int index) {
        if (index < 0 || index > 6) throw new IllegalArgumentException("day-of-week index must be 0..6: " + index);
        return index == 0 ? DayOfWeek.SUNDAY : DayOfWeek.of(index);
    }

    public static int indexOf(DayOfWeek dayOfWeek) {
        return dayOfWeek.getValue() % 7;
    }

    /** First date on or after {@code date} that falls on the weekday with the given 0..6 index. */
    public static LocalDate alignToDayOfWeek(LocalDate date, int dayIndex) {
        return date.with(TemporalAdjusters.nextOrSame(dayOfWeekFromIndex(dayIndex)));
    }

    public static LocalDate clampDayOfMonth(YearMonth month, int dayOfMonth) {
        int day = Math.max(1, Math.min(dayOfMonth, month.lengthOfMonth()));
        return month.atDay(day);
    }

    public static LocalDate clampDayOfYear(int year, int dayOfYear) {
        int day = Math.max(1, Math.min(dayOfYear, Year.of(year).length()));
        return LocalDate.ofYearDay(year, day);
    }

    /** Month/day of {@code anchor} in the given year; Feb 29 falls back to Feb 28. */
    public static LocalDate sameDayInYear(LocalDate anchor, int year) {
        return clampDayOfMonth(YearMonth.of(year, anchor.getMonth()), anchor.getDayOfMonth());
    }

    public static List<LocalDate> datesBetween(LocalDate start, LocalDate endInclusive) {
        List<LocalDate> res = new ArrayList<>();
        if (start == null || endInclusive == null || endInclusive.isBefore(start)) return res;
        for (LocalDate d = start; !d.isAfter(endInclusive); d = d.plusDays(1)) {
            res.add(d);
        }
        return res;
    }
}
