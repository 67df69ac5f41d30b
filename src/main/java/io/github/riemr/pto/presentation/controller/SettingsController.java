package io.github.riemr.pto.presentation.controller;

import io.github.riemr.pto.application.command.SaveSettingsCommand;
import io.github.riemr.pto.application.service.SettingsService;
import io.github.riemr.pto.domain.model.LedgerSettings;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/users/{userId}/settings")
public class SettingsController {
    private final SettingsService settingsService;

    public SettingsController(SettingsService settingsService) {
        this.settingsService = settingsService;
    }

    @GetMapping
    public LedgerSettings get(@PathVariable String userId) {
        return settingsService.getResolved(userId);
    }

    @PutMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public LedgerSettings save(@PathVariable String userId, @RequestBody LedgerSettings settings) {
        return settingsService.handle(new SaveSettingsCommand(userId, settings));
    }
}
