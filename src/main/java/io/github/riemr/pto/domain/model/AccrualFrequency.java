package io.github.riemr.pto.domain.model;

public enum AccrualFrequency {
    DAILY(1, 0, 0),
    WEEKLY(7, 0, 6),
    BIWEEKLY(14, 0, 6),
    MONTHLY(0, 1, 31),
    YEARLY(0, 1, 366);

    private final int periodDays;
    private final int minAnchorDay;
    private final int maxAnchorDay;

    AccrualFrequency(int periodDays, int minAnchorDay, int maxAnchorDay) {
        this.periodDays = periodDays;
        this.minAnchorDay = minAnchorDay;
        this.maxAnchorDay = maxAnchorDay;
    }

    /** Fixed length of one period in days, or 0 for calendar-based periods. */
    public int getPeriodDays() {
        return periodDays;
    }

    public boolean hasFixedPeriod() {
        return periodDays > 0;
    }

    public boolean isAnchorDayValid(Integer anchorDay) {
        if (anchorDay == null || this == DAILY) return true;
        return anchorDay >= minAnchorDay && anchorDay <= maxAnchorDay;
    }

    public String describeAnchorRange() {
        switch (this) {
            case WEEKLY:
            case BIWEEKLY:
                return "day-of-week 0..6 (0 = Sunday)";
            case MONTHLY:
                return "day-of-month 1..31";
            case YEARLY:
                return "day-of-year 1..366";
            default:
                return "none";
        }
    }
}
