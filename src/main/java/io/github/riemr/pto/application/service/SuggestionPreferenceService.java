package io.github.riemr.pto.application.service;

import io.github.riemr.pto.application.repository.SuggestionPreferencesRepository;
import io.github.riemr.pto.domain.model.RankingMode;
import io.github.riemr.pto.domain.model.SuggestionPreferences;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;

@Service
@RequiredArgsConstructor
public class SuggestionPreferenceService {
    private final SuggestionPreferencesRepository repository;
    private final ConfigurationValidator validator;
    private final Clock clock;

    /** Jan 1 two years back to Dec 31 two years ahead, keep 2 days, 4..14 days off, 14 days apart. */
    public SuggestionPreferences defaults() {
        int year = LocalDate.now(clock).getYear();
        return SuggestionPreferences.builder()
                .earliestStart(LocalDate.of(year - 2, 1, 1))
                .latestEnd(LocalDate.of(year + 2, 12, 31))
                .minPTOToKeep(BigDecimal.valueOf(2))
                .minConsecutiveDaysOff(4)
                .maxConsecutiveDaysOff(14)
                .minSpacingBetweenBreaks(14)
                .rankingMode(RankingMode.EFFICIENCY)
                .extendExistingPTO(true)
                .build();
    }

    public SuggestionPreferences load(String userId) {
        return repository.find(userId).orElseGet(this::defaults);
    }

    public SuggestionPreferences validate(SuggestionPreferences preferences) {
        return validator.validate(preferences, "suggestion preferences");
    }

    @Transactional
    public SuggestionPreferences save(String userId, SuggestionPreferences preferences) {
        validate(preferences);
        repository.save(userId, preferences);
        return preferences;
    }
}
