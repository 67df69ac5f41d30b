package io.github.riemr.pto.application.repository;

import io.github.riemr.pto.domain.model.Holiday;

import java.util.List;

public interface HolidayRepository {
    List<Holiday> listByUser(String userId);
    void insert(String userId, Holiday holiday);
    void delete(String userId, Long id);
    // repeating holidays are kept
    void deleteNonRepeatingByYear(String userId, int year);
}
