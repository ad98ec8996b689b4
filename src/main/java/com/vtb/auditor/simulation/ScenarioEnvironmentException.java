package com.vtb.auditor.simulation;

/**
 * Симуляция не смогла оценить атаку из-за окружения (нет аккаунта, нет средств на комиссию, ...)
 */
public class ScenarioEnvironmentException extends RuntimeException {

    private final transient ErrorDescriptor descriptor;

    public ScenarioEnvironmentException(ErrorDescriptor descriptor) {
        super("Окружение не позволило выполнить сценарий: " + descriptor.describe());
        this.descriptor = descriptor;
    }

    public ErrorDescriptor getDescriptor() {
        return descriptor;
    }
}
