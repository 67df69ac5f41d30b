package io.github.riemr.pto.infrastructure.repository;

import io.github.riemr.pto.application.repository.SuggestionPreferencesRepository;
import io.github.riemr.pto.domain.model.RankingMode;
import io.github.riemr.pto.domain.model.SuggestionPreferences;
import io.github.riemr.pto.infrastructure.mapper.SuggestionPreferencesMapper;
import io.github.riemr.pto.infrastructure.persistence.entity.SuggestionPreferencesRow;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public class SuggestionPreferencesRepositoryImpl implements SuggestionPreferencesRepository {

    private final SuggestionPreferencesMapper mapper;

    public SuggestionPreferencesRepositoryImpl(SuggestionPreferencesMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public Optional<SuggestionPreferences> find(String userId) {
        SuggestionPreferencesRow row = mapper.selectByUser(userId);
        if (row == null) return Optional.empty();
        return Optional.of(SuggestionPreferences.builder()
                .earliestStart(row.getEarliestStart())
                .latestEnd(row.getLatestEnd())
                .minPTOToKeep(row.getMinPtoToKeep())
                .minConsecutiveDaysOff(row.getMinConsecutiveDaysOff())
                .maxConsecutiveDaysOff(row.getMaxConsecutiveDaysOff())
                .minSpacingBetweenBreaks(row.getMinSpacingBetweenBreaks())
                .rankingMode(RankingMode.valueOf(row.getRankingMode()))
                .extendExistingPTO(Boolean.TRUE.equals(row.getExtendExistingPto()))
                .build());
    }

    @Override
    public void save(String userId, SuggestionPreferences p) {
        SuggestionPreferencesRow row = new SuggestionPreferencesRow();
        row.setUserId(userId);
        row.setEarliestStart(p.getEarliestStart());
        row.setLatestEnd(p.getLatestEnd());
        row.setMinPtoToKeep(p.getMinPTOToKeep());
        row.setMinConsecutiveDaysOff(p.getMinConsecutiveDaysOff());
        row.setMaxConsecutiveDaysOff(p.getMaxConsecutiveDaysOff());
        row.setMinSpacingBetweenBreaks(p.getMinSpacingBetweenBreaks());
        row.setRankingMode(p.getRankingMode().name());
        row.setExtendExistingPto(p.isExtendExistingPTO());
        if (mapper.update(row) == 0) {
            mapper.insert(row);
        }
    }
}
