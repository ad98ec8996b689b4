package com.vtb.auditor.detection;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Прогоняет все зарегистрированные правила по контексту и возвращает все срабатывания
 */
@Slf4j
public class DetectionEngine {

    private final DetectionRuleRegistry registry;

    public DetectionEngine(DetectionRuleRegistry registry) {
        this.registry = registry;
    }

    public List<RuleMatch> evaluate(DetectionContext context) {
        List<RuleMatch> matches = new ArrayList<>();
        for (DetectionRule rule : registry.rules()) {
            try {
                if (rule.evaluate(context)) {
                    log.debug("Сработало правило {}", rule.getId());
                    matches.add(RuleMatch.of(rule));
                }
            } catch (RuntimeException e) {
                log.error("Правило {} завершилось с ошибкой, считаем несработавшим", rule.getId(), e);
            }
        }
        return matches;
    }

    public DetectionRuleRegistry getRegistry() {
        return registry;
    }
}
