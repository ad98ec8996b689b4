package com.vtb.auditor.catalog;

import com.vtb.auditor.config.AuditorConfig;
import com.vtb.auditor.core.RegistrationException;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Построение каталога программ из секции targets конфигурации
 */
@Slf4j
public final class TargetCatalogLoader {

    private TargetCatalogLoader() {
    }

    public static TargetCatalog load(AuditorConfig config) {
        TargetCatalog catalog = new TargetCatalog();
        for (AuditorConfig.Target target : config.getTargets()) {
            Map<Capability, InstructionBuilder> builders = new EnumMap<>(Capability.class);
            if (target.getInstructions() != null) {
                for (Map.Entry<String, AuditorConfig.InstructionTemplate> entry : target.getInstructions().entrySet()) {
                    try {
                        builders.put(Capability.fromKey(entry.getKey()), new AnchorInstructionBuilder(entry.getValue()));
                    } catch (IllegalArgumentException e) {
                        throw new RegistrationException("Программа " + target.getName() + ": " + e.getMessage(), e);
                    }
                }
            }
            TargetProgram program = TargetProgram.builder()
                .name(target.getName())
                .address(target.getProgramId())
                .capabilities(new ProgramCapabilities(target.getName(), builders))
                .watchAccounts(target.getWatchAccounts() != null ? target.getWatchAccounts() : List.of())
                .accountLayouts(target.getAccountLayouts() != null ? target.getAccountLayouts() : List.of())
                .advisory(target.getAdvisory())
                .build();
            catalog.register(program);
            log.debug("Зарегистрирована программа {} ({}), операции: {}",
                program.getName(), program.getAddress(), builders.keySet());
        }
        log.info("Каталог программ: {} целей", catalog.size());
        return catalog;
    }
}
