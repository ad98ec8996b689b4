package com.vtb.auditor.detection;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * Категория правила детектора и типовые меры по ее устранению
 */
public enum RuleCategory {
    THEFT("theft", List.of(
        "Implement balance change limits and approval mechanisms",
        "Add balance tracking and validation in critical functions")),
    ACCESS_CONTROL("access_control", List.of(
        "Use multi-signature for admin changes",
        "Implement timelocks for critical operations",
        "Add access control modifiers to all admin functions")),
    REENTRANCY("reentrancy", List.of(
        "Implement reentrancy guards on all external functions",
        "Follow checks-effects-interactions pattern",
        "Use mutex locks for critical sections")),
    ARITHMETIC("arithmetic", List.of(
        "Use checked arithmetic operations",
        "Add bounds checking for all numeric inputs")),
    DOS("dos", List.of(
        "Cap the number of instructions and accounts processed per call",
        "Bound loops and account iteration by compute budget")),
    INTEGRITY("integrity", List.of(
        "Protect mint and supply parameters with explicit authority checks",
        "Validate account ownership before mutating program data")),
    TIMING("timing", List.of(
        "Reject timestamps outside an accepted clock drift window",
        "Use the on-chain Clock sysvar instead of caller-supplied time")),
    CROSS_PROGRAM("cross_program", List.of(
        "Validate all CPI calls and return values",
        "Implement program-level access controls",
        "Use signed invocations for critical CPIs"));

    private final String wireName;
    private final List<String> remediations;

    RuleCategory(String wireName, List<String> remediations) {
        this.wireName = wireName;
        this.remediations = remediations;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public List<String> getRemediations() {
        return remediations;
    }
}
