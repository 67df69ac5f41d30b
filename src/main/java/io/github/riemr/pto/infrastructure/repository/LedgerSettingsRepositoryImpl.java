package io.github.riemr.pto.infrastructure.repository;

import io.github.riemr.pto.application.repository.LedgerSettingsRepository;
import io.github.riemr.pto.domain.model.DisplayUnit;
import io.github.riemr.pto.domain.model.LedgerSettings;
import io.github.riemr.pto.infrastructure.mapper.LedgerSettingsMapper;
import io.github.riemr.pto.infrastructure.persistence.entity.LedgerSettingsRow;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public class LedgerSettingsRepositoryImpl implements LedgerSettingsRepository {

    private final LedgerSettingsMapper mapper;

    public LedgerSettingsRepositoryImpl(LedgerSettingsMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public Optional<LedgerSettings> find(String userId) {
        return Optional.ofNullable(mapper.selectByUser(userId)).map(LedgerSettingsRepositoryImpl::toDomain);
    }

    @Override
    public void save(String userId, LedgerSettings settings) {
        LedgerSettingsRow row = toRow(userId, settings);
        if (mapper.update(row) == 0) {
            mapper.insert(row);
        }
    }

    private static LedgerSettings toDomain(LedgerSettingsRow row) {
        return LedgerSettings.builder()
                .initialBalance(row.getInitialBalance())
                .asOfDate(row.getAsOfDate())
                .carryOverLimit(row.getCarryOverLimit())
                .renewalDate(row.getRenewalDate())
                .maxBalance(row.getMaxBalance())
                .allowNegativeBalance(row.getAllowNegativeBalance())
                .displayUnit(row.getDisplayUnit() == null ? null : DisplayUnit.valueOf(row.getDisplayUnit()))
                .hoursPerDay(row.getHoursPerDay())
                .build();
    }

    private static LedgerSettingsRow toRow(String userId, LedgerSettings s) {
        LedgerSettingsRow row = new LedgerSettingsRow();
        row.setUserId(userId);
        row.setInitialBalance(s.getInitialBalance());
        row.setAsOfDate(s.getAsOfDate());
        row.setCarryOverLimit(s.getCarryOverLimit());
        row.setRenewalDate(s.getRenewalDate());
        row.setMaxBalance(s.getMaxBalance());
        row.setAllowNegativeBalance(s.getAllowNegativeBalance());
        row.setDisplayUnit(s.getDisplayUnit() == null ? null : s.getDisplayUnit().name());
        row.setHoursPerDay(s.getHoursPerDay());
        return row;
    }
}
