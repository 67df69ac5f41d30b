package io.github.riemr.pto.application.repository;

import io.github.riemr.pto.domain.model.SuggestionPreferences;

import java.util.Optional;

public interface SuggestionPreferencesRepository {
    Optional<SuggestionPreferences> find(String userId);
    void save(String userId, SuggestionPreferences preferences);
}
