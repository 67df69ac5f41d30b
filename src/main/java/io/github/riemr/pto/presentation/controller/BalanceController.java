package io.github.riemr.pto.presentation.controller;

import io.github.riemr.pto.application.service.LedgerService;
import io.github.riemr.pto.application.service.SettingsService;
import io.github.riemr.pto.domain.model.LedgerSettings;
import io.github.riemr.pto.ledger.BalanceBreakdown;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;

@RestController
@RequestMapping("/api/users/{userId}/balance")
public class BalanceController {
    private final LedgerService ledgerService;
    private final SettingsService settingsService;
    private final Clock clock;

    public BalanceController(LedgerService ledgerService, SettingsService settingsService, Clock clock) {
        this.ledgerService = ledgerService;
        this.settingsService = settingsService;
        this.clock = clock;
    }

    public record BalanceResponse(BalanceBreakdown breakdown, boolean overdrawn) {}

    /** Balance at the start of {@code date} (defaults to today). */
    @GetMapping
    public BalanceResponse balance(@PathVariable String userId,
                                   @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        LocalDate asOf = date != null ? date : LocalDate.now(clock);
        LedgerSettings settings = settingsService.getResolved(userId);
        BalanceBreakdown breakdown = ledgerService.balance(userId, asOf);
        return new BalanceResponse(breakdown, ledgerService.isOverdrawn(breakdown, settings));
    }
}
