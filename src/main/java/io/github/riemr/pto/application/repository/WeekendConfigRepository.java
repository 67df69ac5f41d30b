package io.github.riemr.pto.application.repository;

import java.time.DayOfWeek;
import java.util.Optional;
import java.util.Set;

public interface WeekendConfigRepository {
    // empty when the user never configured weekend days
    Optional<Set<DayOfWeek>> find(String userId);
    void save(String userId, Set<DayOfWeek> weekendDays);
}
