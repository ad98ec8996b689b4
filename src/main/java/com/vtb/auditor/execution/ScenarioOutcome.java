package com.vtb.auditor.execution;

/**
 * Итог одной единицы прогона: атака или самопроверка инфраструктуры
 */
public interface ScenarioOutcome {

    boolean passed();

    String details();
}
