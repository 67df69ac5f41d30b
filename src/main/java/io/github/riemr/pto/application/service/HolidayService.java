package io.github.riemr.pto.application.service;

import io.github.riemr.pto.application.dto.HolidaySyncResult;
import io.github.riemr.pto.application.gateway.HolidayProvider;
import io.github.riemr.pto.application.repository.HolidayRepository;
import io.github.riemr.pto.domain.model.Holiday;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.MonthDay;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;

@Service
@RequiredArgsConstructor
@Slf4j
public class HolidayService {
    static final int MIN_YEAR = 2000;
    static final int MAX_YEAR = 2100;

    private final HolidayRepository repository;
    private final HolidayProvider provider;
    private final ConfigurationValidator validator;

    public List<Holiday> list(String userId) {
        return repository.listByUser(userId);
    }

    @Transactional
    public Holiday add(String userId, Holiday holiday) {
        validator.validate(holiday, "holiday");
        Holiday toSave = holiday.toBuilder().id(null).build();
        repository.insert(userId, toSave);
        return toSave;
    }

    @Transactional
    public void remove(String userId, Long id) {
        repository.delete(userId, id);
    }

    /**
     * Imports one year of public holidays. With {@code replaceExisting} the year's dated
     * holidays are dropped first; repeating ones always stay. Duplicates by (date, name) are skipped.
     */
    @Transactional
    public HolidaySyncResult sync(String userId, String countryCode, int year, boolean replaceExisting) {
        if (countryCode == null || countryCode.isBlank()) {
            throw new IllegalArgumentException("country code is required");
        }
        if (year < MIN_YEAR || year > MAX_YEAR) {
            throw new IllegalArgumentException("year must be between " + MIN_YEAR + " and " + MAX_YEAR);
        }
        String country = countryCode.trim().toUpperCase(Locale.ROOT);
        List<Holiday> fetched = provider.fetchHolidays(country, year);

        if (replaceExisting) {
            repository.deleteNonRepeatingByYear(userId, year);
        }
        Map<String, Holiday> known = new LinkedHashMap<>();
        for (Holiday h : repository.listByUser(userId)) {
            known.put(key(h), h);
        }
        int added = 0;
        for (Holiday h : dedupe(fetched)) {
            if (known.containsKey(key(h))) continue;
            Holiday toSave = h.toBuilder().id(null).countryCode(country).build();
            repository.insert(userId, toSave);
            known.put(key(toSave), toSave);
            added++;
        }
        log.info("Holidays synced: userId={}, country={}, year={}, fetched={}, added={}, replaced={}",
                userId, country, year, fetched.size(), added, replaceExisting);
        return HolidaySyncResult.builder()
                .countryCode(country)
                .year(year)
                .fetched(fetched.size())
                .added(added)
                .replaced(replaceExisting)
                .build();
    }

    /** Keeps the last holiday seen for each (date, name) pair, in first-seen order. */
    public static List<Holiday> dedupe(Collection<Holiday> holidays) {
        Map<String, Holiday> byKey = new LinkedHashMap<>();
        for (Holiday h : holidays) {
            byKey.put(key(h), h);
        }
        return new ArrayList<>(byKey.values());
    }

    /**
     * Dates on which the given holidays fall within {@code [start, end]}. Repeating holidays are
     * projected onto every year of the range; Feb 29 only lands in leap years.
     */
    public static TreeSet<LocalDate> expand(Collection<Holiday> holidays, LocalDate start, LocalDate end) {
        TreeSet<LocalDate> dates = new TreeSet<>();
        if (start == null || end == null || end.isBefore(start)) return dates;
        for (Holiday h : holidays) {
            LocalDate base = h.getDate();
            if (base == null) continue;
            if (h.isRepeatsYearly()) {
                MonthDay md = MonthDay.from(base);
                for (int year = start.getYear(); year <= end.getYear(); year++) {
                    if (!md.isValidYear(year)) continue;
                    LocalDate occurrence = md.atYear(year);
                    if (!occurrence.isBefore(start) && !occurrence.isAfter(end)) dates.add(occurrence);
                }
            } else if (!base.isBefore(start) && !base.isAfter(end)) {
                dates.add(base);
            }
        }
        return dates;
    }

    private static String key(Holiday h) {
        return h.getDate() + "__" + h.getName();
    }
}
