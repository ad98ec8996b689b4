package com.vtb.auditor.catalog;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Аргументы сценария для шаблона инструкции.
 * Аргументы, которых нет в шаблоне, игнорируются.
 */
@Value
@Builder
public class InstructionArgs {
    @Singular
    Map<String, Object> values;
    /**
     * Подмена аккаунта шаблона по его имени
     */
    @Singular
    Map<String, String> accountOverrides;

    public static InstructionArgs none() {
        return InstructionArgs.builder().build();
    }
}
