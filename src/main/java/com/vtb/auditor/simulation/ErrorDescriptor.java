package com.vtb.auditor.simulation;

import lombok.Builder;
import lombok.Value;

/**
 * Разобранная ошибка исполнения транзакции
 */
@Value
@Builder
public class ErrorDescriptor {

    public enum Kind {
        /**
         * Программа или рантайм отвергли транзакцию - атака заблокирована
         */
        PROGRAM_REJECTION,
        /**
         * Окружение не позволило оценить атаку (нет аккаунта, нет средств на комиссию, ...)
         */
        ENVIRONMENT
    }

    Kind kind;
    Integer instructionIndex;
    Long customCode;
    String errorName;
    String message;
    String raw;

    public boolean isProgramRejection() {
        return kind == Kind.PROGRAM_REJECTION;
    }

    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append(errorName != null ? errorName : "UnknownError");
        if (customCode != null) {
            sb.append(" (code ").append(customCode).append(')');
        }
        if (instructionIndex != null) {
            sb.append(" at instruction ").append(instructionIndex);
        }
        if (message != null && !message.isBlank()) {
            sb.append(": ").append(message);
        }
        return sb.toString();
    }
}
