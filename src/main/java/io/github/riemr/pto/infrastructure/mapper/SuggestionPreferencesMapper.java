package io.github.riemr.pto.infrastructure.mapper;

import io.github.riemr.pto.infrastructure.persistence.entity.SuggestionPreferencesRow;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

@Mapper
public interface SuggestionPreferencesMapper {
    SuggestionPreferencesRow selectByUser(@Param("userId") String userId);
    int insert(SuggestionPreferencesRow row);
    int update(SuggestionPreferencesRow row);
}
