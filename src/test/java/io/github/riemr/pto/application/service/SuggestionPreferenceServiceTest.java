package io.github.riemr.pto.application.service;

import io.github.riemr.pto.application.exception.InvalidConfigurationException;
import io.github.riemr.pto.application.repository.SuggestionPreferencesRepository;
import io.github.riemr.pto.domain.model.RankingMode;
import io.github.riemr.pto.domain.model.SuggestionPreferences;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SuggestionPreferenceServiceTest {

    private ValidatorFactory factory;
    private SuggestionPreferencesRepository repository;
    private SuggestionPreferenceService service;

    @BeforeEach
    void setup() {
        factory = Validation.buildDefaultValidatorFactory();
        repository = mock(SuggestionPreferencesRepository.class);
        Clock clock = Clock.fixed(Instant.parse("2025-06-15T10:00:00Z"), ZoneOffset.UTC);
        service = new SuggestionPreferenceService(repository, new ConfigurationValidator(factory.getValidator()), clock);
    }

    @AfterEach
    void tearDown() {
        factory.close();
    }

    @Test
    void load_withoutStoredPreferences_returnsDefaultsAroundCurrentYear() {
        when(repository.find("u1")).thenReturn(Optional.empty());

        SuggestionPreferences prefs = service.load("u1");

        assertThat(prefs.getEarliestStart()).isEqualTo(LocalDate.of(2023, 1, 1));
        assertThat(prefs.getLatestEnd()).isEqualTo(LocalDate.of(2027, 12, 31));
        assertThat(prefs.getMinPTOToKeep()).isEqualByComparingTo("2");
        assertThat(prefs.getMinConsecutiveDaysOff()).isEqualTo(4);
        assertThat(prefs.getMaxConsecutiveDaysOff()).isEqualTo(14);
        assertThat(prefs.getMinSpacingBetweenBreaks()).isEqualTo(14);
        assertThat(prefs.getRankingMode()).isEqualTo(RankingMode.EFFICIENCY);
        assertThat(prefs.isExtendExistingPTO()).isTrue();
    }

    @Test
    void save_validPreferences_persists() {
        SuggestionPreferences prefs = service.defaults().toBuilder().rankingMode(RankingMode.LONGEST).build();

        service.save("u1", prefs);

        verify(repository).save("u1", prefs);
    }

    @Test
    void save_reportsEveryViolation() {
        SuggestionPreferences prefs = service.defaults().toBuilder()
                .minConsecutiveDaysOff(10)
                .maxConsecutiveDaysOff(5)
                .minPTOToKeep(new BigDecimal("-1"))
                .build();

        InvalidConfigurationException ex = catchThrowableOfType(
                () -> service.save("u1", prefs), InvalidConfigurationException.class);

        assertThat(ex.getViolations()).hasSize(2);
        assertThat(ex.getViolations()).anyMatch(v -> v.contains("maxConsecutiveDaysOff"));
        assertThat(ex.getViolations()).anyMatch(v -> v.startsWith("minPTOToKeep"));
        verify(repository, never()).save(any(), any());
    }
}
