package com.vtb.auditor.scenario;

import com.vtb.auditor.catalog.TargetProgram;

/**
 * Единица прогона: сценарий против конкретной программы
 */
public record ScenarioPair(AttackScenario scenario, TargetProgram target) {

    public String describe() {
        return scenario.getId() + " -> " + target.getName();
    }
}
