package com.vtb.auditor.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Категории атак. Порядок объявления задает порядок групп в прогоне.
 */
public enum AttackCategory {
    ACCESS_CONTROL("access_control",
        "Strengthen access control mechanisms and implement role-based permissions"),
    OVERFLOW("overflow",
        "Add overflow protection using checked arithmetic operations"),
    REENTRANCY("reentrancy",
        "Implement reentrancy guards and check-effects-interactions pattern"),
    VALIDATION("validation",
        "Add comprehensive input validation and parameter bounds checking"),
    DOUBLE_SPEND("double_spend",
        "Implement proper state locking and atomic operations"),
    DOS("dos",
        "Add rate limiting and resource consumption controls"),
    ORACLE("oracle",
        "Validate oracle freshness and bound accepted price and timestamp deviations"),
    LOGIC("logic",
        "Review business-logic invariants such as lock periods and reward schedules"),
    CROSS_PROGRAM("cross_program",
        "Review cross-program invocation security and add verification checks"),
    /**
     * Служебная категория самопроверок инфраструктуры, сценариям атак недоступна.
     */
    INFRASTRUCTURE("infrastructure",
        "Resolve infrastructure check failures before trusting attack results");

    private final String wireName;
    private final String advisory;

    AttackCategory(String wireName, String advisory) {
        this.wireName = wireName;
        this.advisory = advisory;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public String getAdvisory() {
        return advisory;
    }

    @JsonCreator
    public static AttackCategory fromWireName(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (AttackCategory category : values()) {
            if (category.wireName.equals(normalized)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Неизвестная категория атаки: " + value);
    }
}
