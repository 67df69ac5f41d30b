package io.github.riemr.pto.optimization.phase;

import io.github.riemr.pto.application.util.LocalDates;
import io.github.riemr.pto.optimization.entity.Segment;
import io.github.riemr.pto.optimization.solution.AnchorInfo;
import io.github.riemr.pto.optimization.solution.AnchorType;
import io.github.riemr.pto.optimization.solution.SuggestedBreak;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns working-day gaps into candidate breaks.
 *
 * <p>Every single gap is a candidate, bounded by its neighbouring non-working segments.
 * Consecutive gaps are also chained into one longer candidate when each gap in the chain
 * has at most {@code mergeGapLimit} working days and the anchors between them count
 * toward the run. A chain stops growing once it exceeds {@code maxDaysOff} or
 * {@code maxPto}.
 */
public class CandidateBreakBuilder {
    private static final DateTimeFormatter LABEL_DATE = DateTimeFormatter.ofPattern("MMM d", Locale.ENGLISH);

    private final List<Segment> segments;
    private final LocalDate windowStart;
    private final LocalDate windowEnd;
    private final boolean extendExisting;
    private final int mergeGapLimit;

    public CandidateBreakBuilder(List<Segment> segments, LocalDate windowStart, LocalDate windowEnd,
                                 boolean extendExisting, int mergeGapLimit) {
        this.segments = segments;
        this.windowStart = windowStart;
        this.windowEnd = windowEnd;
        this.extendExisting = extendExisting;
        this.mergeGapLimit = Math.max(0, mergeGapLimit);
    }

    public List<SuggestedBreak> build(int maxPto, int maxDaysOff) {
        List<SuggestedBreak> candidates = new ArrayList<>();
        for (int first = 0; first < segments.size(); first++) {
            if (!segments.get(first).isWorking()) continue;

            int pto = 0;
            int interiorDays = 0;
            int last = first;
            while (true) {
                Segment gap = segments.get(last);
                if (last > first && gap.length() > mergeGapLimit) break;
                pto += gap.length();
                if (pto > maxPto) break;
                if (last > first && pto + interiorDays > maxDaysOff) break;
                candidates.add(toBreak(first, last, pto, interiorDays));
                // a gap longer than the limit forms a single-gap candidate only
                if (gap.length() > mergeGapLimit) break;

                int nextGap = last + 2;
                if (nextGap >= segments.size()) break;
                Segment anchor = segments.get(last + 1);
                if (!anchor.countsTowardRun(extendExisting)) break;
                interiorDays += anchor.length();
                last = nextGap;
            }
        }
        return candidates;
    }

    private SuggestedBreak toBreak(int first, int last, int pto, int interiorDays) {
        Segment before = first > 0 ? segments.get(first - 1) : null;
        Segment after = last + 1 < segments.size() ? segments.get(last + 1) : null;
        AnchorInfo beforeInfo = before != null ? anchorInfo(before) : boundary(AnchorType.BOUNDARY_START, windowStart);
        AnchorInfo afterInfo = after != null ? anchorInfo(after) : boundary(AnchorType.BOUNDARY_END, windowEnd);

        List<LocalDate> ptoDays = new ArrayList<>();
        for (int i = first; i <= last; i++) {
            if (segments.get(i).isWorking()) ptoDays.addAll(segments.get(i).getDays());
        }

        int totalDaysOff = pto + interiorDays
                + (beforeInfo.isCountsTowardRun() ? beforeInfo.getDayCount() : 0)
                + (afterInfo.isCountsTowardRun() ? afterInfo.getDayCount() : 0);
        LocalDate start = beforeInfo.isCountsTowardRun() ? beforeInfo.getStart() : ptoDays.get(0);
        LocalDate end = afterInfo.isCountsTowardRun() ? afterInfo.getEnd() : ptoDays.get(ptoDays.size() - 1);

        return SuggestedBreak.builder()
                .id(LocalDates.formatLocal(start) + "_" + LocalDates.formatLocal(end) + "_" + pto)
                .start(start)
                .end(end)
                .ptoDays(List.copyOf(ptoDays))
                .ptoRequired(pto)
                .totalDaysOff(totalDaysOff)
                .efficiency((double) totalDaysOff / Math.max(pto, 1))
                .anchorBefore(beforeInfo)
                .anchorAfter(afterInfo)
                .build();
    }

    private AnchorInfo anchorInfo(Segment segment) {
        AnchorType type = AnchorType.fromSources(segment.getSources());
        return AnchorInfo.builder()
                .start(segment.getStart())
                .end(segment.getEnd())
                .dayCount(segment.length())
                .type(type)
                .label(type.getLabel() + " (" + formatRange(segment.getStart(), segment.getEnd()) + ")")
                .countsTowardRun(segment.countsTowardRun(extendExisting))
                .build();
    }

    private static AnchorInfo boundary(AnchorType type, LocalDate reference) {
        return AnchorInfo.builder()
                .start(reference)
                .end(reference)
                .dayCount(0)
                .type(type)
                .label(type.getLabel())
                .countsTowardRun(false)
                .build();
    }

    private static String formatRange(LocalDate start, LocalDate end) {
        if (start.equals(end)) return LABEL_DATE.format(start);
        return LABEL_DATE.format(start) + " - " + LABEL_DATE.format(end);
    }
}
