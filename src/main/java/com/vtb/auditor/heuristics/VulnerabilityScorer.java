package com.vtb.auditor.heuristics;

import com.vtb.auditor.chain.CandidateTransaction;
import com.vtb.auditor.detection.RuleMatch;
import com.vtb.auditor.models.Severity;
import com.vtb.auditor.models.VulnerabilityReport;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Сводит срабатывания правил в один вердикт по выполнению сценария.
 * Уверенность растет линейно: каждое независимое правило добавляет 20.
 */
public class VulnerabilityScorer {

    static final int CONFIDENCE_PER_MATCH = 20;

    public VulnerabilityReport score(String scenarioId, List<RuleMatch> matches, CandidateTransaction transaction) {
        if (matches == null || matches.isEmpty()) {
            return VulnerabilityReport.clean(scenarioId);
        }

        Severity maxSeverity = null;
        List<String> names = new ArrayList<>();
        List<String> exploitPath = new ArrayList<>();
        Set<String> recommendations = new LinkedHashSet<>();
        for (RuleMatch match : matches) {
            if (match.severity() != null && match.severity().isHigherThan(maxSeverity)) {
                maxSeverity = match.severity();
            }
            names.add(match.rule().getName());
            exploitPath.add(match.describe());
            if (match.rule().getCategory() != null) {
                recommendations.addAll(match.rule().getCategory().getRemediations());
            }
        }

        return VulnerabilityReport.builder()
            .scenarioId(scenarioId)
            .vulnerabilityFound(true)
            .confidence(confidence(matches.size()))
            .severity(maxSeverity)
            .details("Detected " + matches.size() + " vulnerability patterns: " + String.join(", ", names))
            .recommendations(new ArrayList<>(recommendations))
            .affectedAccounts(transaction != null ? transaction.writableAccounts() : new ArrayList<>())
            .exploitPath(exploitPath)
            .build();
    }

    public static int confidence(int matchCount) {
        return Math.min(100, Math.max(0, matchCount) * CONFIDENCE_PER_MATCH);
    }
}
