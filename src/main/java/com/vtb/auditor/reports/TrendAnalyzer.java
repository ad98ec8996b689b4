package com.vtb.auditor.reports;

import com.vtb.auditor.models.TestResult;
import com.vtb.auditor.models.TestStatus;
import com.vtb.auditor.models.TestSuiteReport;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class TrendAnalyzer {

    public ReportTrend compare(TestSuiteReport previous, TestSuiteReport current) {
        Map<String, TestStatus> before = statuses(previous);
        Map<String, TestStatus> after = statuses(current);

        List<String> newlyFailing = new ArrayList<>();
        List<String> newlyFixed = new ArrayList<>();
        after.forEach((key, status) -> {
            TestStatus old = before.get(key);
            if (old == TestStatus.PASSED && status == TestStatus.FAILED) {
                newlyFailing.add(key);
            } else if (old == TestStatus.FAILED && status == TestStatus.PASSED) {
                newlyFixed.add(key);
            }
        });

        return ReportTrend.builder()
            .previousDate(previous.getSummary() != null ? previous.getSummary().getTestDate() : null)
            .currentDate(current.getSummary() != null ? current.getSummary().getTestDate() : null)
            .previousScore(previous.getSecurityScore())
            .currentScore(current.getSecurityScore())
            .newlyFailing(newlyFailing)
            .newlyFixed(newlyFixed)
            .build();
    }

    static String key(TestResult result) {
        return result.getScenarioId() + "@" + result.getTargetProgram();
    }

    private static Map<String, TestStatus> statuses(TestSuiteReport report) {
        Map<String, TestStatus> statuses = new LinkedHashMap<>();
        for (TestResult result : report.getResults()) {
            statuses.put(key(result), result.getStatus());
        }
        return statuses;
    }
}
