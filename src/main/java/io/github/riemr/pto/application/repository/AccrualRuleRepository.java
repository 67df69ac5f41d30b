package io.github.riemr.pto.application.repository;

import io.github.riemr.pto.domain.model.AccrualRule;

import java.util.List;
import java.util.Optional;

public interface AccrualRuleRepository {
    List<AccrualRule> listByUser(String userId);
    Optional<AccrualRule> find(String userId, Long ruleId);
    // assigns the generated id to the rule
    void insert(String userId, AccrualRule rule);
    void update(String userId, AccrualRule rule);
}
