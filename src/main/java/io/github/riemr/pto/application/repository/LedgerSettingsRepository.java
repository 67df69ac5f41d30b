package io.github.riemr.pto.application.repository;

import io.github.riemr.pto.domain.model.LedgerSettings;

import java.util.Optional;

public interface LedgerSettingsRepository {
    Optional<LedgerSettings> find(String userId);
    void save(String userId, LedgerSettings settings);
}
