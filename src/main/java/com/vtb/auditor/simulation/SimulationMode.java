package com.vtb.auditor.simulation;

import java.util.Locale;

public enum SimulationMode {
    DRY_RUN("dry-run"),
    COMMITTING("committing");

    private final String configName;

    SimulationMode(String configName) {
        this.configName = configName;
    }

    public String getConfigName() {
        return configName;
    }

    public static SimulationMode fromConfig(String value) {
        if (value == null || value.isBlank()) {
            return DRY_RUN;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (SimulationMode mode : values()) {
            if (mode.configName.equals(normalized)) {
                return mode;
            }
        }
        if ("aggressive".equals(normalized)) {
            return COMMITTING;
        }
        throw new IllegalArgumentException("Неизвестный режим симуляции: " + value);
    }
}
