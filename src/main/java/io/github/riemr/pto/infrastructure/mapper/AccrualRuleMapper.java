package io.github.riemr.pto.infrastructure.mapper;

import io.github.riemr.pto.infrastructure.persistence.entity.AccrualRuleRow;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface AccrualRuleMapper {
    List<AccrualRuleRow> selectByUser(@Param("userId") String userId);
    AccrualRuleRow selectByPrimaryKey(@Param("userId") String userId, @Param("ruleId") Long ruleId);
    int insert(AccrualRuleRow row);
    int update(AccrualRuleRow row);
}
