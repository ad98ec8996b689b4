package com.vtb.auditor.detection;

import com.vtb.auditor.models.Severity;

/**
 * Сработавшее правило
 */
public record RuleMatch(DetectionRule rule, Severity severity) {

    public static RuleMatch of(DetectionRule rule) {
        return new RuleMatch(rule, rule.getSeverity());
    }

    public String describe() {
        return rule.getName() + ": " + rule.getDescription();
    }
}
