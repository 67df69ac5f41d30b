package io.github.riemr.pto.infrastructure.repository;

import io.github.riemr.pto.application.repository.AccrualRuleRepository;
import io.github.riemr.pto.domain.model.AccrualFrequency;
import io.github.riemr.pto.domain.model.AccrualRule;
import io.github.riemr.pto.infrastructure.mapper.AccrualRuleMapper;
import io.github.riemr.pto.infrastructure.persistence.entity.AccrualRuleRow;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class AccrualRuleRepositoryImpl implements AccrualRuleRepository {

    private final AccrualRuleMapper mapper;

    public AccrualRuleRepositoryImpl(AccrualRuleMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public List<AccrualRule> listByUser(String userId) {
        return mapper.selectByUser(userId).stream().map(AccrualRuleRepositoryImpl::toDomain).toList();
    }

    @Override
    public Optional<AccrualRule> find(String userId, Long ruleId) {
        return Optional.ofNullable(mapper.selectByPrimaryKey(userId, ruleId)).map(AccrualRuleRepositoryImpl::toDomain);
    }

    @Override
    public void insert(String userId, AccrualRule rule) {
        AccrualRuleRow row = toRow(userId, rule);
        mapper.insert(row);
        rule.setId(row.getRuleId());
    }

    @Override
    public void update(String userId, AccrualRule rule) {
        mapper.update(toRow(userId, rule));
    }

    private static AccrualRule toDomain(AccrualRuleRow row) {
        return AccrualRule.builder()
                .id(row.getRuleId())
                .name(row.getName())
                .amount(row.getAmount())
                .frequency(AccrualFrequency.valueOf(row.getFrequency()))
                .anchorDay(row.getAnchorDay())
                .effectiveDate(row.getEffectiveDate())
                .endDate(row.getEndDate())
                .active(!Boolean.FALSE.equals(row.getActive()))
                .build();
    }

    private static AccrualRuleRow toRow(String userId, AccrualRule rule) {
        AccrualRuleRow row = new AccrualRuleRow();
        row.setRuleId(rule.getId());
        row.setUserId(userId);
        row.setName(rule.getName());
        row.setAmount(rule.getAmount());
        row.setFrequency(rule.getFrequency().name());
        row.setAnchorDay(rule.getAnchorDay());
        row.setEffectiveDate(rule.getEffectiveDate());
        row.setEndDate(rule.getEndDate());
        row.setActive(rule.isActive());
        return row;
    }
}
