package io.github.riemr.pto.application.service;

import io.github.riemr.pto.application.command.SaveSettingsCommand;
import io.github.riemr.pto.application.exception.InvalidConfigurationException;
import io.github.riemr.pto.application.repository.LedgerSettingsRepository;
import io.github.riemr.pto.domain.model.DisplayUnit;
import io.github.riemr.pto.domain.model.LedgerSettings;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SettingsServiceTest {

    private ValidatorFactory factory;
    private LedgerSettingsRepository repository;
    private SettingsService service;

    @BeforeEach
    void setup() {
        factory = Validation.buildDefaultValidatorFactory();
        repository = mock(LedgerSettingsRepository.class);
        service = new SettingsService(repository, new SettingsResolver(), new ConfigurationValidator(factory.getValidator()));
    }

    @AfterEach
    void tearDown() {
        factory.close();
    }

    @Test
    void handle_savesAndReturnsResolvedSettings() {
        LedgerSettings stored = LedgerSettings.builder().initialBalance(new BigDecimal("20")).build();
        when(repository.find("u1")).thenReturn(Optional.of(stored));

        LedgerSettings result = service.handle(new SaveSettingsCommand("u1", stored));

        verify(repository).save("u1", stored);
        assertThat(result.getInitialBalance()).isEqualByComparingTo("20");
        assertThat(result.getDisplayUnit()).isEqualTo(DisplayUnit.DAYS);
        assertThat(result.getHoursPerDay()).isEqualByComparingTo("8");
        assertThat(result.getAllowNegativeBalance()).isFalse();
    }

    @Test
    void handle_rejectsInvalidSettingsWithoutSaving() {
        LedgerSettings invalid = LedgerSettings.builder().hoursPerDay(new BigDecimal("30")).build();

        assertThatThrownBy(() -> service.handle(new SaveSettingsCommand("u1", invalid)))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("hoursPerDay");
        verify(repository, never()).save(any(), any());
    }

    @Test
    void resolve_localOverridesStoredValues() {
        when(repository.find("u1")).thenReturn(Optional.of(LedgerSettings.builder()
                .initialBalance(new BigDecimal("20")).displayUnit(DisplayUnit.HOURS).build()));

        LedgerSettings result = service.resolve("u1",
                Optional.of(LedgerSettings.builder().initialBalance(new BigDecimal("3")).build()));

        assertThat(result.getInitialBalance()).isEqualByComparingTo("3");
        assertThat(result.getDisplayUnit()).isEqualTo(DisplayUnit.HOURS);
    }
}
