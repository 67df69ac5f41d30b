package io.github.riemr.pto.optimization.solution;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

@Value
@Builder
public class SuggestedBreak {
    String id;
    LocalDate start;
    LocalDate end;
    List<LocalDate> ptoDays;
    int ptoRequired;
    int totalDaysOff;
    double efficiency;
    AnchorInfo anchorBefore;
    AnchorInfo anchorAfter;
}
