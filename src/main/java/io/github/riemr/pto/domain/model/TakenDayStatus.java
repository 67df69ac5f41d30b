package io.github.riemr.pto.domain.model;

public enum TakenDayStatus {
    PLANNED,
    APPROVED,
    TAKEN,
    CANCELLED;

    public boolean consumesBudget() {
        return this != CANCELLED;
    }
}
