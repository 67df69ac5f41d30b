package io.github.riemr.pto.optimization.entity;

public enum AnchorSource {
    WEEKEND,
    HOLIDAY,
    EXISTING
}
