package com.vtb.auditor.execution;

public record InfrastructureCheckOutcome(boolean healthy, String details) implements ScenarioOutcome {

    public static InfrastructureCheckOutcome ok(String details) {
        return new InfrastructureCheckOutcome(true, details);
    }

    public static InfrastructureCheckOutcome failed(String details) {
        return new InfrastructureCheckOutcome(false, details);
    }

    @Override
    public boolean passed() {
        return healthy;
    }
}
