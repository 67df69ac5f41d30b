package io.github.riemr.pto.application.service;

import io.github.riemr.pto.domain.model.DisplayUnit;
import io.github.riemr.pto.domain.model.LedgerSettings;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.function.Function;

/**
 * Merges settings sources field by field. Precedence: local (client-held, unsynced) values,
 * then remote (stored) values, then defaults. A null field falls through to the next source.
 */
@Component
public class SettingsResolver {

    public static final BigDecimal DEFAULT_INITIAL_BALANCE = BigDecimal.valueOf(15);
    public static final BigDecimal DEFAULT_HOURS_PER_DAY = BigDecimal.valueOf(8);

    public LedgerSettings defaults() {
        return LedgerSettings.builder()
                .initialBalance(DEFAULT_INITIAL_BALANCE)
                .displayUnit(DisplayUnit.DAYS)
                .hoursPerDay(DEFAULT_HOURS_PER_DAY)
                .allowNegativeBalance(false)
                .build();
    }

    public LedgerSettings resolveSettings(Optional<LedgerSettings> remote, Optional<LedgerSettings> local) {
        LedgerSettings d = defaults();
        LedgerSettings r = remote.orElse(null);
        LedgerSettings l = local.orElse(null);
        return LedgerSettings.builder()
                .initialBalance(pick(l, r, d, LedgerSettings::getInitialBalance))
                .asOfDate(pick(l, r, d, LedgerSettings::getAsOfDate))
                .carryOverLimit(pick(l, r, d, LedgerSettings::getCarryOverLimit))
                .renewalDate(pick(l, r, d, LedgerSettings::getRenewalDate))
                .maxBalance(pick(l, r, d, LedgerSettings::getMaxBalance))
                .allowNegativeBalance(pick(l, r, d, LedgerSettings::getAllowNegativeBalance))
                .displayUnit(pick(l, r, d, LedgerSettings::getDisplayUnit))
                .hoursPerDay(pick(l, r, d, LedgerSettings::getHoursPerDay))
                .build();
    }

    private static <T> T pick(LedgerSettings local, LedgerSettings remote, LedgerSettings defaults,
                              Function<LedgerSettings, T> field) {
        if (local != null && field.apply(local) != null) return field.apply(local);
        if (remote != null && field.apply(remote) != null) return field.apply(remote);
        return field.apply(defaults);
    }
}
