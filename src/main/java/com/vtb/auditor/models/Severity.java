package com.vtb.auditor.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Уровни критичности находок
 */
public enum Severity {
    CRITICAL("Критический", 4),
    HIGH("Высокий", 3),
    MEDIUM("Средний", 2),
    LOW("Низкий", 1);

    private final String russianName;
    private final int priority;

    Severity(String russianName, int priority) {
        this.russianName = russianName;
        this.priority = priority;
    }

    public String getRussianName() {
        return russianName;
    }

    public int getPriority() {
        return priority;
    }

    public boolean isHigherThan(Severity other) {
        return other == null || priority > other.priority;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Severity fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return Severity.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
