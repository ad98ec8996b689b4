package com.vtb.auditor.cli;

import com.vtb.auditor.execution.TestResultListener;
import com.vtb.auditor.models.TestResult;

import java.io.PrintStream;

/**
 * Построчный вывод хода прогона в консоль
 */
class ConsoleProgressListener implements TestResultListener {

    private final PrintStream out;

    ConsoleProgressListener(PrintStream out) {
        this.out = out;
    }

    @Override
    public void onResult(TestResult result, int completed, int total) {
        String mark = switch (result.getStatus()) {
            case PASSED -> "OK  ";
            case FAILED -> "FAIL";
            case ERROR -> "ERR ";
            case SKIPPED -> "SKIP";
        };
        out.printf("[%d/%d] %s %-40s -> %-20s %s%n", completed, total, mark,
            result.getScenarioId(), result.getTargetProgram(), summary(result));
    }

    private static String summary(TestResult result) {
        if (result.isErrored()) {
            return result.getError();
        }
        if (result.isVulnerabilityFound()) {
            return result.getSeverity().wireName() + ", confidence " + result.getConfidence() + "%";
        }
        return result.getExecutionTimeMs() + " ms";
    }
}
