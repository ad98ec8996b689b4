package com.vtb.auditor.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Терминальный статус пары (сценарий, программа).
 * PASSED - атака предотвращена, FAILED - эксплойт сработал,
 * ERROR - сбой инфраструктуры, SKIPPED - пара не выполнялась.
 */
public enum TestStatus {
    PASSED,
    FAILED,
    ERROR,
    SKIPPED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TestStatus fromWireName(String value) {
        return TestStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
