package com.vtb.auditor.reports;

import com.vtb.auditor.models.AttackCategory;
import com.vtb.auditor.models.BreakdownStats;
import com.vtb.auditor.models.SuiteSummary;
import com.vtb.auditor.models.TestResult;
import com.vtb.auditor.models.TestStatus;
import com.vtb.auditor.models.TestSuiteReport;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Сводит результаты прогона в отчет: счетчики, разбивки, оценку и рекомендации
 */
@Slf4j
public class ReportAggregator {

    public static final String AUDIT_ADVICE = "Consider a professional security audit before mainnet deployment";
    public static final String MONITORING_ADVICE = "Implement comprehensive monitoring and alerting systems";
    public static final String ERRORS_ADVICE =
        "Resolve infrastructure errors and re-run the affected scenarios before trusting this report";

    private final Map<String, String> programAdvisories;

    public ReportAggregator(Map<String, String> programAdvisories) {
        this.programAdvisories = programAdvisories != null ? new LinkedHashMap<>(programAdvisories) : Map.of();
    }

    public TestSuiteReport aggregate(List<TestResult> results, Instant testDate, long executionTimeMs) {
        List<TestResult> ordered = results != null ? new ArrayList<>(results) : new ArrayList<>();

        int passed = 0;
        int failed = 0;
        int errors = 0;
        int skipped = 0;
        for (TestResult result : ordered) {
            switch (result.getStatus()) {
                case PASSED -> passed++;
                case FAILED -> failed++;
                case ERROR -> {
                    failed++;
                    errors++;
                }
                case SKIPPED -> skipped++;
                default -> throw new IllegalStateException("Неизвестный статус " + result.getStatus());
            }
        }
        SuiteSummary summary = SuiteSummary.builder()
            .totalTests(ordered.size())
            .passed(passed)
            .failed(failed)
            .errors(errors)
            .skipped(skipped)
            .executionTimeMs(executionTimeMs)
            .testDate(testDate)
            .build();
        verify(summary);

        TestSuiteReport report = TestSuiteReport.builder()
            .summary(summary)
            .results(ordered)
            .categoryBreakdown(breakdown(ordered, true))
            .programBreakdown(breakdown(ordered, false))
            .recommendations(recommendations(ordered, errors))
            .securityScore(securityScore(passed, ordered.size()))
            .build();
        log.info("Отчет: {} тестов, {} пройдено, {} провалено ({} ошибок), {} пропущено, оценка {}",
            summary.getTotalTests(), passed, failed, errors, skipped, report.getSecurityScore());
        return report;
    }

    public static int securityScore(int passed, int total) {
        if (total <= 0) {
            return 0;
        }
        return (int) Math.round(100.0 * passed / total);
    }

    private void verify(SuiteSummary summary) {
        if (summary.getPassed() < 0 || summary.getFailed() < 0 || summary.getSkipped() < 0
            || summary.getErrors() < 0 || summary.getErrors() > summary.getFailed()) {
            throw new IllegalStateException("Некорректные счетчики сводки: " + summary);
        }
        if (summary.getPassed() + summary.getFailed() + summary.getSkipped() != summary.getTotalTests()) {
            throw new IllegalStateException("Счетчики сводки не сходятся: " + summary);
        }
    }

    /**
     * Пропущенные пары в разбивки не попадают
     */
    private Map<String, BreakdownStats> breakdown(List<TestResult> results, boolean byCategory) {
        Map<String, int[]> counters = new LinkedHashMap<>();
        for (TestResult result : results) {
            if (result.isSkipped()) {
                continue;
            }
            String key = byCategory
                ? (result.getCategory() != null ? result.getCategory().getWireName() : "unknown")
                : (result.getTargetProgram() != null ? result.getTargetProgram() : "unknown");
            int[] counter = counters.computeIfAbsent(key, ignored -> new int[3]);
            counter[0]++;
            if (result.isPassed()) {
                counter[1]++;
            } else {
                counter[2]++;
            }
        }
        Map<String, BreakdownStats> breakdown = new LinkedHashMap<>();
        counters.forEach((key, counter) -> breakdown.put(key, BreakdownStats.builder()
            .total(counter[0])
            .passed(counter[1])
            .failed(counter[2])
            .build()));
        return breakdown;
    }

    private List<String> recommendations(List<TestResult> results, int errors) {
        Set<String> recommendations = new LinkedHashSet<>();
        boolean anyFailed = false;
        for (TestResult result : results) {
            if (result.getStatus() != TestStatus.FAILED) {
                continue;
            }
            anyFailed = true;
            AttackCategory category = result.getCategory();
            if (category != null) {
                recommendations.add(category.getAdvisory());
            }
            String advisory = programAdvisories.get(result.getTargetProgram());
            if (advisory != null && !advisory.isBlank()) {
                recommendations.add(advisory);
            }
        }
        if (anyFailed) {
            recommendations.add(AUDIT_ADVICE);
            recommendations.add(MONITORING_ADVICE);
        }
        if (errors > 0) {
            recommendations.add(ERRORS_ADVICE);
        }
        return new ArrayList<>(recommendations);
    }
}
