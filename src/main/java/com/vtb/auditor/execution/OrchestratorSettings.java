package com.vtb.auditor.execution;

import com.vtb.auditor.config.AuditorConfig;

class OrchestratorSettings {
    private final AuditorConfig.Orchestrator config;

    OrchestratorSettings(AuditorConfig.Orchestrator config) {
        this.config = config;
    }

    long delayMs() {
        return config != null && config.getDelayMs() != null ? config.getDelayMs() : 1000L;
    }

    int scenarioTimeoutSec() {
        return config != null && config.getScenarioTimeoutSec() != null ? config.getScenarioTimeoutSec() : 60;
    }

    int maxScenarios() {
        return config != null && config.getMaxScenarios() != null ? config.getMaxScenarios() : 0;
    }

    int drainTimeoutSec() {
        return config != null && config.getDrainTimeoutSec() != null ? config.getDrainTimeoutSec() : 30;
    }
}
