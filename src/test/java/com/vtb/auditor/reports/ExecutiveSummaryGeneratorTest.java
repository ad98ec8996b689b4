package com.vtb.auditor.reports;

import com.vtb.auditor.models.AttackCategory;
import com.vtb.auditor.models.Severity;
import com.vtb.auditor.models.TestResult;
import com.vtb.auditor.models.TestSuiteReport;
import com.vtb.auditor.reports.ExecutiveSummaryGenerator.RiskLevel;
import com.vtb.auditor.testsupport.Results;
import com.vtb.auditor.testsupport.TestFixtures;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExecutiveSummaryGeneratorTest {

    private final ReportAggregator aggregator = new ReportAggregator(Map.of());

    @Test
    void testRiskLevelThresholds() {
        assertEquals(RiskLevel.CRITICAL, ExecutiveSummaryGenerator.riskLevel(withFindings(Severity.CRITICAL, 1)));
        assertEquals(RiskLevel.LOW, ExecutiveSummaryGenerator.riskLevel(withFindings(Severity.HIGH, 2)));
        assertEquals(RiskLevel.HIGH, ExecutiveSummaryGenerator.riskLevel(withFindings(Severity.HIGH, 3)));
        assertEquals(RiskLevel.LOW, ExecutiveSummaryGenerator.riskLevel(withFindings(Severity.MEDIUM, 5)));
        assertEquals(RiskLevel.MEDIUM, ExecutiveSummaryGenerator.riskLevel(withFindings(Severity.MEDIUM, 6)));
    }

    @Test
    void testRenderContainsScoreAndFindings() {
        TestSuiteReport report = aggregator.aggregate(List.of(
            Results.vulnerable("reentrancy-claim", AttackCategory.REENTRANCY, "staking", Severity.HIGH),
            Results.passed("access-unauthorized-admin", AttackCategory.ACCESS_CONTROL, "swap")),
            TestFixtures.NOW, 100);

        String markdown = new ExecutiveSummaryGenerator().render(report);

        assertTrue(markdown.contains("| **Security Score** | 50/100 |"));
        assertTrue(markdown.contains("| **Risk Level** | LOW |"));
        assertTrue(markdown.contains("- `reentrancy-claim` on staking (high, confidence 20%)"));
        assertTrue(markdown.contains("- **reentrancy**: 1 of 1 failed"));
        assertTrue(markdown.contains(ReportAggregator.AUDIT_ADVICE));
        assertFalse(markdown.contains("## Trend"));
    }

    @Test
    void testRenderWithTrend() {
        TestSuiteReport report = aggregator.aggregate(List.of(
            Results.passed("reentrancy-claim", AttackCategory.REENTRANCY, "staking")), TestFixtures.NOW, 10);
        ReportTrend trend = ReportTrend.builder()
            .previousScore(40)
            .currentScore(100)
            .newlyFixed(List.of("reentrancy-claim@staking"))
            .build();

        String markdown = new ExecutiveSummaryGenerator(trend).render(report);

        assertTrue(markdown.contains("- Score: 40 -> 100 (+60)"));
        assertTrue(markdown.contains("- Newly fixed: reentrancy-claim@staking"));
        assertTrue(markdown.contains("- Newly failing: none"));
    }

    private TestSuiteReport withFindings(Severity severity, int count) {
        List<TestResult> results = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            results.add(Results.vulnerable("scenario-" + i, AttackCategory.LOGIC, "staking", severity));
        }
        return aggregator.aggregate(results, TestFixtures.NOW, 10);
    }
}
