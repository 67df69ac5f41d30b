package io.github.riemr.pto.application.service;

import io.github.riemr.pto.application.command.SaveSettingsCommand;
import io.github.riemr.pto.application.repository.LedgerSettingsRepository;
import io.github.riemr.pto.domain.model.LedgerSettings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class SettingsService {
    private final LedgerSettingsRepository repository;
    private final SettingsResolver resolver;
    private final ConfigurationValidator validator;

    public LedgerSettings getResolved(String userId) {
        return resolve(userId, Optional.empty());
    }

    public LedgerSettings resolve(String userId, Optional<LedgerSettings> local) {
        return resolver.resolveSettings(repository.find(userId), local);
    }

    @Transactional
    public LedgerSettings handle(SaveSettingsCommand command) {
        LedgerSettings settings = validator.validate(command.getSettings(), "settings");
        repository.save(command.getUserId(), settings);
        if (settings.getCarryOverLimit() != null && settings.getRenewalDate() == null) {
            log.info("Settings saved with a carryover limit but no renewal date; no resets will apply: userId={}",
                    command.getUserId());
        }
        log.info("Settings saved: userId={}", command.getUserId());
        return getResolved(command.getUserId());
    }
}
