package io.github.riemr.pto.application.service;

import io.github.riemr.pto.application.repository.AccrualRuleRepository;
import io.github.riemr.pto.application.repository.TakenDayRepository;
import io.github.riemr.pto.domain.model.LedgerSettings;
import io.github.riemr.pto.ledger.BalanceBreakdown;
import io.github.riemr.pto.ledger.LedgerSnapshot;
import io.github.riemr.pto.ledger.PtoLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Loads a user's ledger snapshot and runs the ledger over it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {
    private final SettingsService settingsService;
    private final AccrualRuleRepository accrualRuleRepository;
    private final TakenDayRepository takenDayRepository;
    private final PtoLedger ledger;

    public LedgerSnapshot snapshot(String userId, Optional<LedgerSettings> localSettings) {
        return LedgerSnapshot.builder()
                .settings(settingsService.resolve(userId, localSettings))
                .rules(accrualRuleRepository.listByUser(userId))
                .takenDays(takenDayRepository.listByUser(userId))
                .build();
    }

    public BalanceBreakdown balance(String userId, LocalDate date) {
        return balance(userId, date, Optional.empty());
    }

    public BalanceBreakdown balance(String userId, LocalDate date, Optional<LedgerSettings> localSettings) {
        BalanceBreakdown breakdown = ledger.breakdownAsOf(snapshot(userId, localSettings), date);
        log.debug("Balance computed: userId={}, date={}, balance={}", userId, date, breakdown.getBalance());
        return breakdown;
    }

    /** Balance at the close of {@code lastDay}, converted to PTO days. */
    public BigDecimal availableDays(LedgerSnapshot snapshot, LocalDate lastDay) {
        BigDecimal balance = ledger.balanceAsOf(snapshot, lastDay.plusDays(1));
        return ledger.toDays(balance, snapshot.getSettings());
    }

    public boolean isOverdrawn(BalanceBreakdown breakdown, LedgerSettings settings) {
        return breakdown.getBalance().signum() < 0 && !Boolean.TRUE.equals(settings.getAllowNegativeBalance());
    }
}
