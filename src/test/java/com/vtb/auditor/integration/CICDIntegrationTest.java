package com.vtb.auditor.integration;

import com.vtb.auditor.models.AttackCategory;
import com.vtb.auditor.models.Severity;
import com.vtb.auditor.models.TestSuiteReport;
import com.vtb.auditor.reports.ReportAggregator;
import com.vtb.auditor.testsupport.Results;
import com.vtb.auditor.testsupport.TestFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Коды выхода для CI/CD
 */
class CICDIntegrationTest {

    private final ReportAggregator aggregator = new ReportAggregator(Map.of());

    @Test
    void testCriticalAlwaysFails() {
        TestSuiteReport report = aggregator.aggregate(List.of(
            Results.vulnerable("access-unauthorized-admin", AttackCategory.ACCESS_CONTROL, "swap", Severity.CRITICAL)),
            TestFixtures.NOW, 10);

        assertEquals(CICDIntegration.EXIT_VULNERABLE, CICDIntegration.getExitCode(report, false));
    }

    @Test
    void testNonCriticalFailsOnlyWhenRequested() {
        TestSuiteReport report = aggregator.aggregate(List.of(
            Results.vulnerable("reentrancy-claim", AttackCategory.REENTRANCY, "staking", Severity.HIGH)),
            TestFixtures.NOW, 10);

        assertEquals(CICDIntegration.EXIT_OK, CICDIntegration.getExitCode(report, false));
        assertEquals(CICDIntegration.EXIT_VULNERABLE, CICDIntegration.getExitCode(report, true));
    }

    @Test
    void testErrorsDoNotFailBuild() {
        TestSuiteReport report = aggregator.aggregate(List.of(
            Results.errored("reentrancy-claim", AttackCategory.REENTRANCY, "staking"),
            Results.passed("validation-zero-amount-swap", AttackCategory.VALIDATION, "swap")), TestFixtures.NOW, 10);

        assertEquals(CICDIntegration.EXIT_OK, CICDIntegration.getExitCode(report, true),
            "Ошибка инфраструктуры не является найденной уязвимостью");
    }

    @Test
    void testAllAttacksErroredIsNotEvaluated() {
        TestSuiteReport report = aggregator.aggregate(List.of(
            Results.errored("reentrancy-claim", AttackCategory.REENTRANCY, "staking"),
            Results.errored("validation-zero-amount-swap", AttackCategory.VALIDATION, "swap"),
            Results.skipped("dos-resource-exhaustion", AttackCategory.DOS, "swap")), TestFixtures.NOW, 10);

        assertEquals(CICDIntegration.EXIT_NOT_EVALUATED, CICDIntegration.getExitCode(report, false));
        assertEquals(CICDIntegration.EXIT_NOT_EVALUATED, CICDIntegration.getExitCode(report, true));
    }

    @Test
    void testPassedInfrastructureChecksDoNotCountAsEvaluation() {
        TestSuiteReport report = aggregator.aggregate(List.of(
            Results.passed("infra-cluster-health", AttackCategory.INFRASTRUCTURE, "cluster"),
            Results.errored("validation-zero-amount-swap", AttackCategory.VALIDATION, "swap")), TestFixtures.NOW, 10);

        assertEquals(CICDIntegration.EXIT_NOT_EVALUATED, CICDIntegration.getExitCode(report, false));
    }

    @Test
    void testEmptyRunIsNotAnEvaluationFailure() {
        TestSuiteReport report = aggregator.aggregate(List.of(), TestFixtures.NOW, 0);

        assertEquals(CICDIntegration.EXIT_OK, CICDIntegration.getExitCode(report, true));
    }

    @Test
    void testCriticalTakesPrecedenceOverErrors() {
        TestSuiteReport report = aggregator.aggregate(List.of(
            Results.errored("reentrancy-claim", AttackCategory.REENTRANCY, "staking"),
            Results.vulnerable("access-unauthorized-admin", AttackCategory.ACCESS_CONTROL, "swap", Severity.CRITICAL)),
            TestFixtures.NOW, 10);

        assertEquals(CICDIntegration.EXIT_VULNERABLE, CICDIntegration.getExitCode(report, false));
    }

    @Test
    void testNullReport() {
        assertEquals(CICDIntegration.EXIT_OK, CICDIntegration.getExitCode(null, true));
    }
}
