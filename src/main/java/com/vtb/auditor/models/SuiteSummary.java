package com.vtb.auditor.models;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Сводка прогона. passed + failed + skipped == totalTests,
 * errors - информационная часть failed.
 */
@Value
@Builder
@Jacksonized
public class SuiteSummary {
    int totalTests;
    int passed;
    int failed;
    int errors;
    int skipped;
    long executionTimeMs;
    Instant testDate;
}
