package io.github.riemr.pto.application.service;

import io.github.riemr.pto.application.command.ApplySuggestionsCommand;
import io.github.riemr.pto.application.exception.ResourceNotFoundException;
import io.github.riemr.pto.application.repository.TakenDayRepository;
import io.github.riemr.pto.domain.model.TakenDay;
import io.github.riemr.pto.domain.model.TakenDayStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class TakenDayService {
    private final TakenDayRepository repository;

    public List<TakenDay> list(String userId) {
        return repository.listByUser(userId).stream()
                .sorted(Comparator.comparing(TakenDay::getDate))
                .collect(Collectors.toList());
    }

    /**
     * Adds a planned day, or removes the day if one is already recorded.
     * @return the day now stored, or empty when it was removed
     */
    @Transactional
    public Optional<TakenDay> toggle(String userId, LocalDate date) {
        Objects.requireNonNull(date, "date");
        Optional<TakenDay> existing = repository.findByDate(userId, date);
        if (existing.isPresent()) {
            repository.delete(userId, existing.get().getId());
            return Optional.empty();
        }
        TakenDay day = TakenDay.builder().date(date).status(TakenDayStatus.PLANNED).build();
        repository.insert(userId, day);
        return Optional.of(day);
    }

    @Transactional
    public TakenDay changeStatus(String userId, Long id, TakenDayStatus status) {
        Objects.requireNonNull(status, "status");
        TakenDay day = repository.find(userId, id)
                .orElseThrow(() -> new ResourceNotFoundException("taken day", id));
        repository.updateStatus(userId, id, status);
        return day.toBuilder().status(status).build();
    }

    /**
     * Stores every date not already consuming budget as planned PTO. Cancelled days on the
     * same date are reinstated instead of duplicated.
     * @return number of dates that now consume budget and did not before
     */
    @Transactional
    public int handle(ApplySuggestionsCommand command) {
        String userId = command.getUserId();
        int added = 0;
        for (LocalDate date : new TreeSet<>(command.getDates())) {
            Optional<TakenDay> existing = repository.findByDate(userId, date);
            if (existing.isEmpty()) {
                repository.insert(userId, TakenDay.builder()
                        .date(date)
                        .status(TakenDayStatus.PLANNED)
                        .description("Suggested break")
                        .build());
                added++;
            } else if (!existing.get().consumesBudget()) {
                repository.updateStatus(userId, existing.get().getId(), TakenDayStatus.PLANNED);
                added++;
            }
        }
        log.info("Suggestions applied: userId={}, requested={}, added={}", userId, command.getDates().size(), added);
        return added;
    }
}
