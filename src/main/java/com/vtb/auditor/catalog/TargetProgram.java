package com.vtb.auditor.catalog;

import com.vtb.auditor.config.AuditorConfig;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Программа, против которой запускаются атаки
 */
@Value
@Builder
public class TargetProgram {
    String name;
    String address;
    ProgramCapabilities capabilities;
    /**
     * Аккаунты, которые снимаются до и после каждой атаки на эту программу
     */
    @Builder.Default
    List<AuditorConfig.AccountTemplate> watchAccounts = new ArrayList<>();
    @Builder.Default
    List<AuditorConfig.AccountLayout> accountLayouts = new ArrayList<>();
    /**
     * Рекомендация для отчета, если по программе есть провалы
     */
    String advisory;
}
