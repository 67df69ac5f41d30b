package io.github.riemr.pto.presentation.controller;

import io.github.riemr.pto.application.service.AccrualRuleService;
import io.github.riemr.pto.domain.model.AccrualRule;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/users/{userId}/accrual-rules")
public class AccrualRuleController {
    private final AccrualRuleService service;

    public AccrualRuleController(AccrualRuleService service) {
        this.service = service;
    }

    @GetMapping
    public List<AccrualRule> list(@PathVariable String userId) {
        return service.list(userId);
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<AccrualRule> create(@PathVariable String userId, @RequestBody AccrualRule rule) {
        return ResponseEntity.status(HttpStatus.CREATED).body(service.create(userId, rule));
    }

    @PutMapping(path = "/{id}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public AccrualRule update(@PathVariable String userId, @PathVariable Long id, @RequestBody AccrualRule rule) {
        return service.update(userId, id, rule);
    }

    @PostMapping("/{id}/deactivate")
    public AccrualRule deactivate(@PathVariable String userId, @PathVariable Long id) {
        return service.deactivate(userId, id);
    }
}
