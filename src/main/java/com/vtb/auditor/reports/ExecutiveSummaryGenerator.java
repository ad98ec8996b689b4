package com.vtb.auditor.reports;

import com.vtb.auditor.models.BreakdownStats;
import com.vtb.auditor.models.Severity;
import com.vtb.auditor.models.SuiteSummary;
import com.vtb.auditor.models.TestResult;
import com.vtb.auditor.models.TestSuiteReport;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Краткий Markdown-отчет для руководства
 */
@Slf4j
public class ExecutiveSummaryGenerator implements ReportGenerator {

    static final int TOP_RECOMMENDATIONS = 5;

    public enum RiskLevel {
        CRITICAL, HIGH, MEDIUM, LOW
    }

    private final ReportTrend trend;

    public ExecutiveSummaryGenerator() {
        this(null);
    }

    public ExecutiveSummaryGenerator(ReportTrend trend) {
        this.trend = trend;
    }

    public static RiskLevel riskLevel(TestSuiteReport report) {
        if (report.countVulnerabilities(Severity.CRITICAL) > 0) {
            return RiskLevel.CRITICAL;
        }
        if (report.countVulnerabilities(Severity.HIGH) > 2) {
            return RiskLevel.HIGH;
        }
        if (report.countVulnerabilities(Severity.MEDIUM) > 5) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.LOW;
    }

    @Override
    public void generate(TestSuiteReport report, Path outputPath) throws IOException {
        if (report == null || report.getSummary() == null) {
            throw new IllegalArgumentException("Отчет без сводки");
        }
        if (outputPath.getParent() != null) {
            Files.createDirectories(outputPath.getParent());
        }
        Files.writeString(outputPath, render(report));
        log.debug("Executive summary сохранен: {}", outputPath.toAbsolutePath());
    }

    public String render(TestSuiteReport report) {
        SuiteSummary summary = report.getSummary();
        StringBuilder md = new StringBuilder();
        md.append("# Solana Program Security Audit\n\n");
        md.append("**Generated:** ").append(summary.getTestDate()).append("  \n");
        md.append("**Duration:** ").append(summary.getExecutionTimeMs()).append(" ms\n\n");

        md.append("## Executive Summary\n\n");
        md.append("| Metric | Value |\n|--------|-------|\n");
        md.append("| **Security Score** | ").append(report.getSecurityScore()).append("/100 |\n");
        md.append("| **Risk Level** | ").append(riskLevel(report)).append(" |\n");
        md.append("| **Total Tests** | ").append(summary.getTotalTests()).append(" |\n");
        md.append("| **Passed** | ").append(summary.getPassed()).append(" |\n");
        md.append("| **Failed** | ").append(summary.getFailed()).append(" |\n");
        md.append("| **Errors** | ").append(summary.getErrors()).append(" |\n");
        md.append("| **Skipped** | ").append(summary.getSkipped()).append(" |\n\n");

        md.append("### Findings by Severity\n\n| Severity | Count |\n|----------|-------|\n");
        for (Severity severity : Severity.values()) {
            md.append("| ").append(severity.wireName()).append(" | ")
                .append(report.countVulnerabilities(severity)).append(" |\n");
        }
        md.append('\n');

        List<Map.Entry<String, BreakdownStats>> failing = report.getCategoryBreakdown().entrySet().stream()
            .filter(entry -> entry.getValue().getFailed() > 0)
            .toList();
        if (!failing.isEmpty()) {
            md.append("## Failing Categories\n\n");
            for (Map.Entry<String, BreakdownStats> entry : failing) {
                md.append("- **").append(entry.getKey()).append("**: ")
                    .append(entry.getValue().getFailed()).append(" of ")
                    .append(entry.getValue().getTotal()).append(" failed\n");
            }
            md.append('\n');
        }

        List<TestResult> vulnerable = report.getResults().stream()
            .filter(TestResult::isVulnerabilityFound)
            .toList();
        if (!vulnerable.isEmpty()) {
            md.append("## Confirmed Findings\n\n");
            for (TestResult result : vulnerable) {
                md.append("- `").append(result.getScenarioId()).append("` on ")
                    .append(result.getTargetProgram()).append(" (")
                    .append(result.getSeverity() != null ? result.getSeverity().wireName() : "n/a")
                    .append(", confidence ").append(result.getConfidence()).append("%)\n");
            }
            md.append('\n');
        }

        if (!report.getRecommendations().isEmpty()) {
            md.append("## Top Recommendations\n\n");
            report.getRecommendations().stream()
                .limit(TOP_RECOMMENDATIONS)
                .forEach(recommendation -> md.append("1. ").append(recommendation).append('\n'));
            md.append('\n');
        }

        if (trend != null) {
            md.append("## Trend\n\n");
            md.append("- Score: ").append(trend.getPreviousScore()).append(" -> ")
                .append(trend.getCurrentScore()).append(" (")
                .append(trend.scoreDelta() >= 0 ? "+" : "").append(trend.scoreDelta()).append(")\n");
            md.append("- Newly failing: ").append(trend.getNewlyFailing().isEmpty()
                ? "none" : String.join(", ", trend.getNewlyFailing())).append('\n');
            md.append("- Newly fixed: ").append(trend.getNewlyFixed().isEmpty()
                ? "none" : String.join(", ", trend.getNewlyFixed())).append('\n');
        }
        return md.toString();
    }

    @Override
    public String getFileExtension() {
        return "md";
    }
}
