package io.github.riemr.pto.infrastructure.mapper;

import io.github.riemr.pto.infrastructure.persistence.entity.TakenDayRow;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDate;
import java.util.List;

@Mapper
public interface TakenDayMapper {
    List<TakenDayRow> selectByUser(@Param("userId") String userId);
    TakenDayRow selectByPrimaryKey(@Param("userId") String userId, @Param("takenDayId") Long takenDayId);
    TakenDayRow selectByDate(@Param("userId") String userId, @Param("dayDate") LocalDate dayDate);
    int insert(TakenDayRow row);
    int updateStatus(@Param("userId") String userId, @Param("takenDayId") Long takenDayId, @Param("status") String status);
    int deleteByPrimaryKey(@Param("userId") String userId, @Param("takenDayId") Long takenDayId);
}
