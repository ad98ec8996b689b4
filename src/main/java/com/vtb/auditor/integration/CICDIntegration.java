package com.vtb.auditor.integration;

import com.vtb.auditor.models.AttackCategory;
import com.vtb.auditor.models.Severity;
import com.vtb.auditor.models.SuiteSummary;
import com.vtb.auditor.models.TestResult;
import com.vtb.auditor.models.TestSuiteReport;
import lombok.extern.slf4j.Slf4j;

/**
 * Интеграция с CI/CD системами
 * GitHub Actions, GitLab CI и т.д.
 */
@Slf4j
public class CICDIntegration {

    public static final int EXIT_OK = 0;
    public static final int EXIT_VULNERABLE = 1;
    public static final int EXIT_CONFIG_ERROR = 2;
    public static final int EXIT_NOT_EVALUATED = 3;

    /**
     * Определить exit code на основе результатов аудита
     *
     * @param report отчет прогона
     * @param failOnVulnerability прерывать ли сборку при любой найденной уязвимости
     * @return exit code (0 = успех, 1 = провал, 3 = ни одна атака не получила вердикт)
     */
    public static int getExitCode(TestSuiteReport report, boolean failOnVulnerability) {
        if (report == null) {
            log.warn("Отчет null, возвращаем код успеха");
            return EXIT_OK;
        }

        if (report.countVulnerabilities(Severity.CRITICAL) > 0) {
            log.error("Обнаружены CRITICAL уязвимости. Сборка провалена.");
            return EXIT_VULNERABLE;
        }

        if (failOnVulnerability && report.countVulnerabilities(null) > 0) {
            log.error("Обнаружены уязвимости (--fail-on-vulnerability). Сборка провалена.");
            return EXIT_VULNERABLE;
        }

        if (nothingEvaluated(report)) {
            log.error("Все выполненные сценарии атак завершились ошибкой окружения. Аудит не состоялся.");
            return EXIT_NOT_EVALUATED;
        }

        if (report.getSummary() != null && report.getSummary().getErrors() > 0) {
            log.warn("{} сценариев завершились с ошибкой инфраструктуры", report.getSummary().getErrors());
        }
        log.info("Критичных уязвимостей не обнаружено");
        return EXIT_OK;
    }

    /**
     * Были выполненные атаки, и ни одна не дошла до вердикта passed/failed
     */
    static boolean nothingEvaluated(TestSuiteReport report) {
        int executed = 0;
        for (TestResult result : report.getResults()) {
            if (result.isSkipped() || result.getCategory() == AttackCategory.INFRASTRUCTURE) {
                continue;
            }
            if (!result.isErrored()) {
                return false;
            }
            executed++;
        }
        return executed > 0;
    }

    /**
     * Вывести краткую сводку для CI/CD
     */
    public static void printCISummary(TestSuiteReport report) {
        if (report == null || report.getSummary() == null) {
            log.warn("Отчет null, пропускаем вывод");
            return;
        }
        SuiteSummary summary = report.getSummary();

        System.out.println("\n=== Solana Program Audit Summary ===");
        System.out.println("Test Date: " + (summary.getTestDate() != null ? summary.getTestDate() : "N/A"));
        System.out.println("Security Score: " + report.getSecurityScore() + "/100");
        System.out.println("\nTests:");
        System.out.println("  TOTAL:    " + summary.getTotalTests());
        System.out.println("  PASSED:   " + summary.getPassed());
        System.out.println("  FAILED:   " + summary.getFailed() + " (errors: " + summary.getErrors() + ")");
        System.out.println("  SKIPPED:  " + summary.getSkipped());
        System.out.println("\nVulnerabilities:");
        System.out.println("  CRITICAL: " + report.countVulnerabilities(Severity.CRITICAL));
        System.out.println("  HIGH:     " + report.countVulnerabilities(Severity.HIGH));
        System.out.println("  MEDIUM:   " + report.countVulnerabilities(Severity.MEDIUM));
        System.out.println("  LOW:      " + report.countVulnerabilities(Severity.LOW));
        System.out.println("Audit Duration: " + summary.getExecutionTimeMs() + " ms");
        System.out.println("====================================\n");
    }

    /**
     * Создать аннотации для GitHub Actions
     */
    public static void printGitHubAnnotations(TestSuiteReport report) {
        if (report == null) {
            return;
        }

        for (TestResult result : report.getResults()) {
            if (result.isPassed() || result.isSkipped()) {
                continue;
            }
            String level;
            if (result.isErrored()) {
                level = "warning";
            } else {
                level = switch (result.getSeverity() != null ? result.getSeverity() : Severity.LOW) {
                    case CRITICAL, HIGH -> "error";
                    case MEDIUM -> "warning";
                    default -> "notice";
                };
            }
            System.out.printf("::%s title=%s::%s [%s] - %s%n",
                level, result.getScenarioId(), result.getTargetProgram(),
                result.getCategory() != null ? result.getCategory().getWireName() : "unknown",
                result.isErrored() ? result.getError() : result.getDetails());
        }
    }
}
