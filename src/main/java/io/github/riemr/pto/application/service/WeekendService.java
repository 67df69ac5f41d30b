package io.github.riemr.pto.application.service;

import io.github.riemr.pto.application.repository.WeekendConfigRepository;
import io.github.riemr.pto.optimization.entity.OffDayCalendar;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.DayOfWeek;
import java.util.EnumSet;
import java.util.Set;

@Service
@RequiredArgsConstructor
public class WeekendService {
    private final WeekendConfigRepository repository;

    public Set<DayOfWeek> getWeekendDays(String userId) {
        return repository.find(userId).orElse(OffDayCalendar.DEFAULT_WEEKEND);
    }

    @Transactional
    public Set<DayOfWeek> save(String userId, Set<DayOfWeek> weekendDays) {
        Set<DayOfWeek> days = weekendDays == null || weekendDays.isEmpty()
                ? EnumSet.noneOf(DayOfWeek.class)
                : EnumSet.copyOf(weekendDays);
        if (days.size() == DayOfWeek.values().length) {
            throw new IllegalArgumentException("at least one working day is required");
        }
        repository.save(userId, days);
        return days;
    }
}
