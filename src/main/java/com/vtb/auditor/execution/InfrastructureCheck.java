package com.vtb.auditor.execution;

/**
 * Самопроверка окружения аудита. Результат попадает в категорию infrastructure.
 */
public interface InfrastructureCheck {

    String id();

    String name();

    /**
     * Программа-цель проверки, либо null для проверок всего окружения
     */
    default String targetProgram() {
        return null;
    }

    InfrastructureCheckOutcome run();
}
