package io.github.riemr.pto.ledger;

import io.github.riemr.pto.domain.model.AccrualRule;
import io.github.riemr.pto.domain.model.LedgerSettings;
import io.github.riemr.pto.domain.model.TakenDay;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Everything the ledger reads for one computation. Settings must already be resolved.
 */
@Value
@Builder
public class LedgerSnapshot {
    LedgerSettings settings;
    @Singular
    List<AccrualRule> rules;
    @Singular
    List<TakenDay> takenDays;
}
