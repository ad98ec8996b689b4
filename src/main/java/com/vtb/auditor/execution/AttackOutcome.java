package com.vtb.auditor.execution;

import com.vtb.auditor.detection.RuleMatch;
import com.vtb.auditor.models.VulnerabilityReport;
import com.vtb.auditor.simulation.ErrorDescriptor;
import com.vtb.auditor.snapshot.StateDiff;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Итог атаки. Если программа отвергла транзакцию, атака считается отраженной,
 * а сработавшие правила остаются только как наблюдения.
 */
public record AttackOutcome(VulnerabilityReport report,
                            ErrorDescriptor rejection,
                            List<RuleMatch> observations,
                            StateDiff diff) implements ScenarioOutcome {

    public boolean rejectedByProgram() {
        return rejection != null;
    }

    public boolean vulnerabilityFound() {
        return !rejectedByProgram() && report.isVulnerabilityFound();
    }

    @Override
    public boolean passed() {
        return !vulnerabilityFound();
    }

    @Override
    public String details() {
        StringBuilder details = new StringBuilder();
        if (rejectedByProgram()) {
            details.append("Attack blocked: ").append(rejection.describe());
            if (!observations.isEmpty()) {
                details.append("; observed patterns: ")
                    .append(observations.stream().map(match -> match.rule().getName())
                        .collect(Collectors.joining(", ")));
            }
        } else {
            details.append(report.getDetails());
        }
        if (diff != null && !diff.isEmpty()) {
            details.append("; state diff: ").append(diff.summary());
        }
        return details.toString();
    }
}
