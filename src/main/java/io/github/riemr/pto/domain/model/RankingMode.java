package io.github.riemr.pto.domain.model;

public enum RankingMode {
    EFFICIENCY,
    LONGEST,
    LEAST_PTO,
    EARLIEST
}
