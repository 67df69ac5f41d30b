package io.github.riemr.pto.domain.model;

public enum DisplayUnit {
    DAYS,
    HOURS
}
