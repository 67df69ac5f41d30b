package io.github.riemr.pto.infrastructure.repository;

import io.github.riemr.pto.application.repository.WeekendConfigRepository;
import io.github.riemr.pto.application.util.LocalDates;
import io.github.riemr.pto.infrastructure.mapper.WeekendConfigMapper;
import io.github.riemr.pto.infrastructure.persistence.entity.WeekendConfigRow;
import org.springframework.stereotype.Repository;

import java.time.DayOfWeek;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

@Repository
public class WeekendConfigRepositoryImpl implements WeekendConfigRepository {

    private final WeekendConfigMapper mapper;

    public WeekendConfigRepositoryImpl(WeekendConfigMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public Optional<Set<DayOfWeek>> find(String userId) {
        WeekendConfigRow row = mapper.selectByUser(userId);
        if (row == null) return Optional.empty();
        return Optional.of(decode(row.getWeekendDays()));
    }

    @Override
    public void save(String userId, Set<DayOfWeek> weekendDays) {
        WeekendConfigRow row = new WeekendConfigRow();
        row.setUserId(userId);
        row.setWeekendDays(encode(weekendDays));
        if (mapper.update(row) == 0) {
            mapper.insert(row);
        }
    }

    static String encode(Set<DayOfWeek> days) {
        return days.stream()
                .map(LocalDates::indexOf)
                .sorted()
                .map(String::valueOf)
                .collect(Collectors.joining(","));
    }

    static Set<DayOfWeek> decode(String csv) {
        Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        if (csv == null || csv.isBlank()) return days;
        Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(Integer::parseInt)
                .map(LocalDates::dayOfWeekFromIndex)
                .forEach(days::add);
        return days;
    }
}
