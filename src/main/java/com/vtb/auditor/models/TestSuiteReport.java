package com.vtb.auditor.models;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Итоговый отчет прогона. Строится один раз агрегатором и далее не меняется.
 * Ключи breakdown-карт - имена категорий (access_control, ...) и программ.
 */
@Value
@Builder
@Jacksonized
public class TestSuiteReport {
    SuiteSummary summary;
    @Builder.Default
    List<TestResult> results = new ArrayList<>();
    @Builder.Default
    Map<String, BreakdownStats> categoryBreakdown = new LinkedHashMap<>();
    @Builder.Default
    Map<String, BreakdownStats> programBreakdown = new LinkedHashMap<>();
    @Builder.Default
    List<String> recommendations = new ArrayList<>();
    int securityScore;

    public boolean hasFailures() {
        return summary != null && summary.getFailed() > 0;
    }

    public long countVulnerabilities(Severity severity) {
        return results.stream()
            .filter(TestResult::isVulnerabilityFound)
            .filter(result -> severity == null || result.getSeverity() == severity)
            .count();
    }
}
