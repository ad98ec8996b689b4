package com.vtb.auditor.detection;

import com.vtb.auditor.core.RegistrationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Открытый реестр правил. Порядок регистрации сохраняется.
 */
public class DetectionRuleRegistry {

    private final Map<String, DetectionRule> rules = new LinkedHashMap<>();

    public static DetectionRuleRegistry standard() {
        return StandardRules.registerAll(new DetectionRuleRegistry());
    }

    /**
     * Правило прогоняется на пустом контексте: падение здесь лучше, чем в середине прогона
     */
    public DetectionRuleRegistry register(DetectionRule rule) {
        if (rules.containsKey(rule.getId())) {
            throw new RegistrationException("Правило уже зарегистрировано: " + rule.getId());
        }
        if (rule.getSeverity() == null || rule.getCategory() == null) {
            throw new RegistrationException("У правила " + rule.getId() + " не заданы критичность или категория");
        }
        try {
            rule.evaluate(DetectionContext.baseline());
        } catch (RuntimeException e) {
            throw new RegistrationException("Правило " + rule.getId() + " падает на пустом контексте: "
                + e.getMessage(), e);
        }
        rules.put(rule.getId(), rule);
        return this;
    }

    public List<DetectionRule> rules() {
        return new ArrayList<>(rules.values());
    }

    public Optional<DetectionRule> find(String id) {
        return Optional.ofNullable(rules.get(id));
    }

    public int size() {
        return rules.size();
    }
}
