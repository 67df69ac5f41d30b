package io.github.riemr.pto.application.service;

import io.github.riemr.pto.application.exception.ResourceNotFoundException;
import io.github.riemr.pto.application.repository.AccrualRuleRepository;
import io.github.riemr.pto.domain.model.AccrualRule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class AccrualRuleService {
    private final AccrualRuleRepository repository;
    private final ConfigurationValidator validator;

    public List<AccrualRule> list(String userId) {
        return repository.listByUser(userId);
    }

    @Transactional
    public AccrualRule create(String userId, AccrualRule rule) {
        validator.validate(rule, "accrual rule");
        AccrualRule toSave = rule.toBuilder().id(null).build();
        repository.insert(userId, toSave);
        log.info("Accrual rule created: userId={}, ruleId={}, frequency={}", userId, toSave.getId(), toSave.getFrequency());
        return toSave;
    }

    @Transactional
    public AccrualRule update(String userId, Long ruleId, AccrualRule rule) {
        require(userId, ruleId);
        AccrualRule toSave = validator.validate(rule.toBuilder().id(ruleId).build(), "accrual rule");
        repository.update(userId, toSave);
        return toSave;
    }

    /** Rules are never deleted so balances in the past stay reproducible. */
    @Transactional
    public AccrualRule deactivate(String userId, Long ruleId) {
        AccrualRule existing = require(userId, ruleId);
        if (!existing.isActive()) return existing;
        AccrualRule inactive = existing.toBuilder().active(false).build();
        repository.update(userId, inactive);
        log.info("Accrual rule deactivated: userId={}, ruleId={}", userId, ruleId);
        return inactive;
    }

    private AccrualRule require(String userId, Long ruleId) {
        return repository.find(userId, ruleId)
                .orElseThrow(() -> new ResourceNotFoundException("accrual rule", ruleId));
    }
}
