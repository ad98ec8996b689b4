package com.vtb.auditor.core;

/**
 * Ошибка регистрации при сборке движка: дубликат идентификатора,
 * ссылка на неизвестную программу, некорректное правило.
 * Бросается до начала прогона.
 */
public class RegistrationException extends RuntimeException {

    public RegistrationException(String message) {
        super(message);
    }

    public RegistrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
