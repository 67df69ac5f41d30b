package io.github.riemr.pto.presentation.controller;

import io.github.riemr.pto.application.service.WeekendService;
import io.github.riemr.pto.application.util.LocalDates;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.DayOfWeek;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/** Weekend days travel as 0..6 indexes, 0 = Sunday. */
@RestController
@RequestMapping("/api/users/{userId}/weekend")
public class WeekendController {
    private final WeekendService service;

    public WeekendController(WeekendService service) {
        this.service = service;
    }

    public record WeekendDays(List<Integer> weekendDays) {}

    @GetMapping
    public WeekendDays get(@PathVariable String userId) {
        return toResponse(service.getWeekendDays(userId));
    }

    @PutMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public WeekendDays save(@PathVariable String userId, @RequestBody WeekendDays req) {
        Set<DayOfWeek> days = req.weekendDays() == null ? Set.of() : req.weekendDays().stream()
                .map(LocalDates::dayOfWeekFromIndex)
                .collect(Collectors.toSet());
        return toResponse(service.save(userId, days));
    }

    private static WeekendDays toResponse(Set<DayOfWeek> days) {
        return new WeekendDays(days.stream().map(LocalDates::indexOf).sorted().collect(Collectors.toList()));
    }
}
