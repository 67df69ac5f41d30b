package io.github.riemr.pto.application.service;

import io.github.riemr.pto.domain.model.DisplayUnit;
import io.github.riemr.pto.domain.model.LedgerSettings;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class SettingsResolverTest {

    private final SettingsResolver resolver = new SettingsResolver();

    @Test
    void nothingStored_givesDefaults() {
        LedgerSettings resolved = resolver.resolveSettings(Optional.empty(), Optional.empty());

        assertThat(resolved.getInitialBalance()).isEqualByComparingTo("15");
        assertThat(resolved.getDisplayUnit()).isEqualTo(DisplayUnit.DAYS);
        assertThat(resolved.getHoursPerDay()).isEqualByComparingTo("8");
        assertThat(resolved.getAllowNegativeBalance()).isFalse();
        assertThat(resolved.getAsOfDate()).isNull();
    }

    @Test
    void localWinsOverRemote_fieldByField() {
        LedgerSettings remote = LedgerSettings.builder()
                .initialBalance(new BigDecimal("20"))
                .asOfDate(LocalDate.of(2024, 1, 1))
                .displayUnit(DisplayUnit.HOURS)
                .build();
        LedgerSettings local = LedgerSettings.builder()
                .initialBalance(new BigDecimal("5"))
                .maxBalance(new BigDecimal("30"))
                .build();

        LedgerSettings resolved = resolver.resolveSettings(Optional.of(remote), Optional.of(local));

        assertThat(resolved.getInitialBalance()).isEqualByComparingTo("5");
        assertThat(resolved.getMaxBalance()).isEqualByComparingTo("30");
        assertThat(resolved.getAsOfDate()).isEqualTo(LocalDate.of(2024, 1, 1));
        assertThat(resolved.getDisplayUnit()).isEqualTo(DisplayUnit.HOURS);
        assertThat(resolved.getHoursPerDay()).isEqualByComparingTo("8");
    }
}
