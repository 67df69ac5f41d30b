package io.github.riemr.pto.infrastructure.mapper;

import io.github.riemr.pto.infrastructure.persistence.entity.HolidayRow;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDate;
import java.util.List;

@Mapper
public interface HolidayMapper {
    List<HolidayRow> selectByUser(@Param("userId") String userId);
    int insert(HolidayRow row);
    int deleteByPrimaryKey(@Param("userId") String userId, @Param("holidayId") Long holidayId);
    int deleteNonRepeatingBetween(@Param("userId") String userId,
                                  @Param("from") LocalDate from,
                                  @Param("to") LocalDate to);
}
