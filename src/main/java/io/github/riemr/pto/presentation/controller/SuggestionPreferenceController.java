package io.github.riemr.pto.presentation.controller;

import io.github.riemr.pto.application.service.SuggestionPreferenceService;
import io.github.riemr.pto.domain.model.SuggestionPreferences;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/users/{userId}/suggestion-preferences")
public class SuggestionPreferenceController {
    private final SuggestionPreferenceService service;

    public SuggestionPreferenceController(SuggestionPreferenceService service) {
        this.service = service;
    }

    @GetMapping
    public SuggestionPreferences get(@PathVariable String userId) {
        return service.load(userId);
    }

    @PutMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public SuggestionPreferences save(@PathVariable String userId, @RequestBody SuggestionPreferences preferences) {
        return service.save(userId, preferences);
    }
}
