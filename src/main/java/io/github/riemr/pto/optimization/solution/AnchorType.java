package io.github.riemr.pto.optimization.solution;

import io.github.riemr.pto.optimization.entity.AnchorSource;

import java.util.Set;

public enum AnchorType {
    WEEKEND("Weekend"),
    HOLIDAY("Holiday"),
    MIXED("Holiday + Weekend"),
    EXISTING("Existing PTO"),
    BOUNDARY_START("Timeframe start"),
    BOUNDARY_END("Timeframe end");

    private final String label;

    AnchorType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static AnchorType fromSources(Set<AnchorSource> sources) {
        boolean weekend = sources.contains(AnchorSource.WEEKEND);
        boolean holiday = sources.contains(AnchorSource.HOLIDAY);
        if (weekend && holiday) return MIXED;
        if (weekend) return WEEKEND;
        if (holiday) return HOLIDAY;
        return EXISTING;
    }
}
