package io.github.riemr.pto.infrastructure.mapper;

import io.github.riemr.pto.infrastructure.persistence.entity.WeekendConfigRow;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

@Mapper
public interface WeekendConfigMapper {
    WeekendConfigRow selectByUser(@Param("userId") String userId);
    int insert(WeekendConfigRow row);
    int update(WeekendConfigRow row);
}
