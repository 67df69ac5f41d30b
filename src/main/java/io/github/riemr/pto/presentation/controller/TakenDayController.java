package io.github.riemr.pto.presentation.controller;

import io.github.riemr.pto.application.service.TakenDayService;
import io.github.riemr.pto.domain.model.TakenDay;
import io.github.riemr.pto.domain.model.TakenDayStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/users/{userId}/taken-days")
public class TakenDayController {
    private final TakenDayService service;

    public TakenDayController(TakenDayService service) {
        this.service = service;
    }

    public record ToggleRequest(LocalDate date) {}

    public record ToggleResponse(LocalDate date, boolean taken, TakenDay day) {}

    public record StatusRequest(TakenDayStatus status) {}

    @GetMapping
    public List<TakenDay> list(@PathVariable String userId) {
        return service.list(userId);
    }

    @PostMapping(path = "/toggle", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> toggle(@PathVariable String userId, @RequestBody ToggleRequest req) {
        if (req == null || req.date() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "date is required"));
        }
        Optional<TakenDay> day = service.toggle(userId, req.date());
        return ResponseEntity.ok(new ToggleResponse(req.date(), day.isPresent(), day.orElse(null)));
    }

    @PutMapping(path = "/{id}/status", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> changeStatus(@PathVariable String userId, @PathVariable Long id, @RequestBody StatusRequest req) {
        if (req == null || req.status() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "status is required"));
        }
        return ResponseEntity.ok(service.changeStatus(userId, id, req.status()));
    }
}
