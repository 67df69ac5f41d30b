package io.github.riemr.pto.infrastructure.repository;

import io.github.riemr.pto.application.repository.HolidayRepository;
import io.github.riemr.pto.domain.model.Holiday;
import io.github.riemr.pto.infrastructure.mapper.HolidayMapper;
import io.github.riemr.pto.infrastructure.persistence.entity.HolidayRow;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public class HolidayRepositoryImpl implements HolidayRepository {

    private final HolidayMapper mapper;

    public HolidayRepositoryImpl(HolidayMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public List<Holiday> listByUser(String userId) {
        return mapper.selectByUser(userId).stream().map(HolidayRepositoryImpl::toDomain).toList();
    }

    @Override
    public void insert(String userId, Holiday holiday) {
        HolidayRow row = new HolidayRow();
        row.setUserId(userId);
        row.setName(holiday.getName());
        row.setHolidayDate(holiday.getDate());
        row.setRepeatsYearly(holiday.isRepeatsYearly());
        row.setPaid(holiday.isPaid());
        row.setCountryCode(holiday.getCountryCode());
        mapper.insert(row);
        holiday.setId(row.getHolidayId());
    }

    @Override
    public void delete(String userId, Long id) {
        mapper.deleteByPrimaryKey(userId, id);
    }

    @Override
    public void deleteNonRepeatingByYear(String userId, int year) {
        mapper.deleteNonRepeatingBetween(userId, LocalDate.of(year, 1, 1), LocalDate.of(year, 12, 31));
    }

    private static Holiday toDomain(HolidayRow row) {
        return Holiday.builder()
                .id(row.getHolidayId())
                .name(row.getName())
                .date(row.getHolidayDate())
                .repeatsYearly(Boolean.TRUE.equals(row.getRepeatsYearly()))
                .paid(!Boolean.FALSE.equals(row.getPaid()))
                .countryCode(row.getCountryCode())
                .build();
    }
}
