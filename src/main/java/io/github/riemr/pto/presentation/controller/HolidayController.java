package io.github.riemr.pto.presentation.controller;

import io.github.riemr.pto.application.dto.HolidaySyncResult;
import io.github.riemr.pto.application.service.HolidayService;
import io.github.riemr.pto.domain.model.Holiday;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/users/{userId}/holidays")
public class HolidayController {
    private final HolidayService service;

    public HolidayController(HolidayService service) {
        this.service = service;
    }

    @GetMapping
    public List<Holiday> list(@PathVariable String userId) {
        return service.list(userId);
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Holiday> add(@PathVariable String userId, @RequestBody Holiday holiday) {
        return ResponseEntity.status(HttpStatus.CREATED).body(service.add(userId, holiday));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> remove(@PathVariable String userId, @PathVariable Long id) {
        service.remove(userId, id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/sync")
    public HolidaySyncResult sync(@PathVariable String userId,
                                  @RequestParam String country,
                                  @RequestParam int year,
                                  @RequestParam(defaultValue = "false") boolean replace) {
        return service.sync(userId, country, year, replace);
    }
}
