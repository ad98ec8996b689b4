package com.vtb.auditor.models;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.List;

/**
 * Вердикт по одному выполнению сценария
 */
@Value
@Builder
@Jacksonized
public class VulnerabilityReport {
    String scenarioId;
    boolean vulnerabilityFound;
    /**
     * 0-100, по 20 за каждое сработавшее правило
     */
    int confidence;
    /**
     * null, если уязвимость не найдена
     */
    Severity severity;
    String details;
    @Builder.Default
    List<String> recommendations = new ArrayList<>();
    @Builder.Default
    List<String> affectedAccounts = new ArrayList<>();
    @Builder.Default
    List<String> exploitPath = new ArrayList<>();

    public static VulnerabilityReport clean(String scenarioId) {
        return VulnerabilityReport.builder()
            .scenarioId(scenarioId)
            .vulnerabilityFound(false)
            .confidence(0)
            .details("No vulnerabilities detected")
            .build();
    }
}
