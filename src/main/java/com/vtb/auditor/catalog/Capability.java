package com.vtb.auditor.catalog;

import java.util.Locale;

/**
 * Операции, которые сценарии умеют запрашивать у программы-цели
 */
public enum Capability {
    PRIVILEGED_OPERATION,
    FUNDING,
    CLAIM,
    SWAP,
    WITHDRAW,
    PRICE_UPDATE,
    /**
     * Покупка доступа с комиссией платформы
     */
    PURCHASE,
    /**
     * Перевод ресурса в доступное состояние по истечении таймлока
     */
    TRIGGER;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Capability fromKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("Пустое имя операции");
        }
        String normalized = key.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return Capability.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Неизвестная операция: " + key, e);
        }
    }
}
