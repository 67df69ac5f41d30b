package io.github.riemr.pto.application.repository;

import io.github.riemr.pto.domain.model.TakenDay;
import io.github.riemr.pto.domain.model.TakenDayStatus;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface TakenDayRepository {
    List<TakenDay> listByUser(String userId);
    Optional<TakenDay> find(String userId, Long id);
    Optional<TakenDay> findByDate(String userId, LocalDate date);
    void insert(String userId, TakenDay day);
    void updateStatus(String userId, Long id, TakenDayStatus status);
    void delete(String userId, Long id);
}
