package com.vtb.auditor.chain;

/**
 * Не удалось собрать инструкцию или транзакцию: нет аккаунта, неверный аргумент,
 * цель не поддерживает нужную операцию.
 */
public class InstructionBuildException extends RuntimeException {

    public InstructionBuildException(String message) {
        super(message);
    }

    public InstructionBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
