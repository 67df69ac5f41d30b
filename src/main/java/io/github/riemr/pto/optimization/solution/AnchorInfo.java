package io.github.riemr.pto.optimization.solution;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Non-working span (or search window edge) adjoining a suggested break.
 */
@Value
@Builder
public class AnchorInfo {
    LocalDate start;
    LocalDate end;
    int dayCount;
    AnchorType type;
    String label;
    boolean countsTowardRun;
}
