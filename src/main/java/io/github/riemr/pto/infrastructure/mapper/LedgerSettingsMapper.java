package io.github.riemr.pto.infrastructure.mapper;

import io.github.riemr.pto.infrastructure.persistence.entity.LedgerSettingsRow;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

@Mapper
public interface LedgerSettingsMapper {
    LedgerSettingsRow selectByUser(@Param("userId") String userId);
    int insert(LedgerSettingsRow row);
    int update(LedgerSettingsRow row);
}
