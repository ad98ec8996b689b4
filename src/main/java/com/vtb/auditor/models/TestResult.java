package com.vtb.auditor.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Результат одной пары (сценарий, программа).
 * Для сценариев атак passed == !vulnerabilityFound, результаты ERROR
 * не являются ни успехом, ни найденной уязвимостью.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class TestResult {
    String scenarioId;
    String scenarioName;
    AttackCategory category;
    String targetProgram;
    TestStatus status;
    boolean passed;
    boolean vulnerabilityFound;
    Severity severity;
    int confidence;
    long executionTimeMs;
    String error;
    String details;
    VulnerabilityReport vulnerabilityReport;
    Instant timestamp;

    @JsonIgnore
    public boolean isErrored() {
        return status == TestStatus.ERROR;
    }

    @JsonIgnore
    public boolean isSkipped() {
        return status == TestStatus.SKIPPED;
    }
}
