package io.github.riemr.pto.optimization.entity;

import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Maximal run of consecutive days that are either all working or all non-working.
 */
@Getter
@ToString
public class Segment {
    private final boolean working;
    private final List<LocalDate> days = new ArrayList<>();
    private final Set<AnchorSource> sources = EnumSet.noneOf(AnchorSource.class);

    public Segment(boolean working) {
        this.working = working;
    }

    public void add(LocalDate day, Set<AnchorSource> daySources) {
        days.add(day);
        sources.addAll(daySources);
    }

    public LocalDate getStart() {
        return days.get(0);
    }

    public LocalDate getEnd() {
        return days.get(days.size() - 1);
    }

    public int length() {
        return days.size();
    }

    public List<LocalDate> getDays() {
        return Collections.unmodifiableList(days);
    }

    /** Non-working segment that lengthens a break: always for weekends/holidays, for existing PTO only when allowed. */
    public boolean countsTowardRun(boolean extendExisting) {
        if (working) return false;
        if (sources.contains(AnchorSource.WEEKEND) || sources.contains(AnchorSource.HOLIDAY)) return true;
        return extendExisting && sources.contains(AnchorSource.EXISTING);
    }
}
