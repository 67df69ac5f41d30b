package io.github.riemr.pto.infrastructure.repository;

import io.github.riemr.pto.application.repository.TakenDayRepository;
import io.github.riemr.pto.domain.model.TakenDay;
import io.github.riemr.pto.domain.model.TakenDayStatus;
import io.github.riemr.pto.infrastructure.mapper.TakenDayMapper;
import io.github.riemr.pto.infrastructure.persistence.entity.TakenDayRow;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public class TakenDayRepositoryImpl implements TakenDayRepository {

    private final TakenDayMapper mapper;

    public TakenDayRepositoryImpl(TakenDayMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public List<TakenDay> listByUser(String userId) {
        return mapper.selectByUser(userId).stream().map(TakenDayRepositoryImpl::toDomain).toList();
    }

    @Override
    public Optional<TakenDay> find(String userId, Long id) {
        return Optional.ofNullable(mapper.selectByPrimaryKey(userId, id)).map(TakenDayRepositoryImpl::toDomain);
    }

    @Override
    public Optional<TakenDay> findByDate(String userId, LocalDate date) {
        return Optional.ofNullable(mapper.selectByDate(userId, date)).map(TakenDayRepositoryImpl::toDomain);
    }

    @Override
    public void insert(String userId, TakenDay day) {
        TakenDayRow row = new TakenDayRow();
        row.setUserId(userId);
        row.setDayDate(day.getDate());
        row.setStatus((day.getStatus() == null ? TakenDayStatus.PLANNED : day.getStatus()).name());
        row.setDescription(day.getDescription());
        mapper.insert(row);
        day.setId(row.getTakenDayId());
    }

    @Override
    public void updateStatus(String userId, Long id, TakenDayStatus status) {
        mapper.updateStatus(userId, id, status.name());
    }

    @Override
    public void delete(String userId, Long id) {
        mapper.deleteByPrimaryKey(userId, id);
    }

    private static TakenDay toDomain(TakenDayRow row) {
        return TakenDay.builder()
                .id(row.getTakenDayId())
                .date(row.getDayDate())
                .status(row.getStatus() == null ? TakenDayStatus.PLANNED : TakenDayStatus.valueOf(row.getStatus()))
                .description(row.getDescription())
                .build();
    }
}
