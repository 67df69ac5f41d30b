package io.github.riemr.pto.presentation.controller;

import io.github.riemr.pto.application.command.ApplySuggestionsCommand;
import io.github.riemr.pto.application.service.SuggestionService;
import io.github.riemr.pto.application.service.TakenDayService;
import io.github.riemr.pto.domain.model.SuggestionPreferences;
import io.github.riemr.pto.optimization.solution.OptimizationResult;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/users/{userId}/suggestions")
public class SuggestionController {
    private final SuggestionService suggestionService;
    private final TakenDayService takenDayService;

    public SuggestionController(SuggestionService suggestionService, TakenDayService takenDayService) {
        this.suggestionService = suggestionService;
        this.takenDayService = takenDayService;
    }

    public record ApplyRequest(List<LocalDate> dates) {}

    /** Runs the optimizer with the stored preferences, or with the posted ones when a body is given. */
    @PostMapping
    public OptimizationResult suggest(@PathVariable String userId,
                                      @RequestBody(required = false) SuggestionPreferences override) {
        return suggestionService.suggest(userId, Optional.ofNullable(override));
    }

    @PostMapping(path = "/apply", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> apply(@PathVariable String userId, @RequestBody ApplyRequest req) {
        if (req == null || req.dates() == null || req.dates().isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "dates is required"));
        }
        int added = takenDayService.handle(new ApplySuggestionsCommand(userId, req.dates()));
        return ResponseEntity.ok(Map.of("added", added));
    }
}
