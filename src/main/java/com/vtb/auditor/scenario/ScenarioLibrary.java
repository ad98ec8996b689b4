package com.vtb.auditor.scenario;

import com.vtb.auditor.catalog.TargetCatalog;
import com.vtb.auditor.catalog.TargetProgram;
import com.vtb.auditor.config.AuditorConfig;
import com.vtb.auditor.core.RegistrationException;
import com.vtb.auditor.models.AttackCategory;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Реестр сценариев атак. Ошибки регистрации обнаруживаются до первого обращения к сети.
 */
@Slf4j
public class ScenarioLibrary {

    private final TargetCatalog catalog;
    private final Map<String, Registration> registrations = new LinkedHashMap<>();

    public ScenarioLibrary(TargetCatalog catalog) {
        this.catalog = catalog;
    }

    public ScenarioLibrary register(AttackScenario scenario) {
        if (scenario.getId() == null || scenario.getId().isBlank()) {
            throw new RegistrationException("Сценарий без идентификатора: " + scenario.getName());
        }
        if (registrations.containsKey(scenario.getId())) {
            throw new RegistrationException("Сценарий уже зарегистрирован: " + scenario.getId());
        }
        if (scenario.getCategory() == null || scenario.getCategory() == AttackCategory.INFRASTRUCTURE) {
            throw new RegistrationException("Недопустимая категория сценария " + scenario.getId()
                + ": " + scenario.getCategory());
        }
        if (scenario.getSeverity() == null) {
            throw new RegistrationException("У сценария " + scenario.getId() + " не задана критичность");
        }
        Set<String> programs = scenario.applicablePrograms();
        validatePrograms(scenario.getId(), programs);
        registrations.put(scenario.getId(), new Registration(scenario, programs, true));
        return this;
    }

    /**
     * Переопределения из секции scenarios конфигурации: отключение и список программ
     */
    public void applyOverrides(Map<String, AuditorConfig.ScenarioOverride> overrides) {
        if (overrides == null) {
            return;
        }
        for (Map.Entry<String, AuditorConfig.ScenarioOverride> entry : overrides.entrySet()) {
            Registration current = registrations.get(entry.getKey());
            if (current == null) {
                throw new RegistrationException("Переопределение для неизвестного сценария: " + entry.getKey());
            }
            AuditorConfig.ScenarioOverride override = entry.getValue();
            Set<String> programs = current.programs();
            if (override.getPrograms() != null && !override.getPrograms().isEmpty()) {
                programs = new LinkedHashSet<>(override.getPrograms());
                validatePrograms(entry.getKey(), programs);
            }
            registrations.put(entry.getKey(), new Registration(current.scenario(), programs, override.isEnabled()));
        }
    }

    public List<AttackScenario> scenarios() {
        List<AttackScenario> scenarios = new ArrayList<>();
        for (Registration registration : registrations.values()) {
            scenarios.add(registration.scenario());
        }
        return scenarios;
    }

    public Optional<AttackScenario> find(String id) {
        Registration registration = registrations.get(id);
        return registration != null ? Optional.of(registration.scenario()) : Optional.empty();
    }

    public int size() {
        return registrations.size();
    }

    /**
     * Пары (сценарий, программа) в порядке категорий, затем регистрации, затем каталога.
     * Пустые наборы фильтров не ограничивают выбор.
     */
    public List<ScenarioPair> plan(Set<AttackCategory> categories, Set<String> programs, Set<String> scenarioIds) {
        warnUnknown(scenarioIds, programs);
        List<ScenarioPair> pairs = new ArrayList<>();
        for (AttackCategory category : AttackCategory.values()) {
            if (!categories.isEmpty() && !categories.contains(category)) {
                continue;
            }
            for (Registration registration : registrations.values()) {
                AttackScenario scenario = registration.scenario();
                if (!registration.enabled() || scenario.getCategory() != category) {
                    continue;
                }
                if (!scenarioIds.isEmpty() && !scenarioIds.contains(scenario.getId())) {
                    continue;
                }
                for (TargetProgram target : catalog.all()) {
                    if (!programs.isEmpty() && !programs.contains(target.getName())) {
                        continue;
                    }
                    if (!registration.appliesTo(target.getName()) || !scenario.supports(target)) {
                        continue;
                    }
                    pairs.add(new ScenarioPair(scenario, target));
                }
            }
        }
        log.info("Запланировано пар (сценарий, программа): {}", pairs.size());
        return pairs;
    }

    private void validatePrograms(String scenarioId, Set<String> programs) {
        if (programs == null || programs.isEmpty()) {
            throw new RegistrationException("Сценарий " + scenarioId + " не применим ни к одной программе");
        }
        for (String program : programs) {
            if (!"*".equals(program) && !catalog.contains(program)) {
                throw new RegistrationException("Сценарий " + scenarioId + " ссылается на неизвестную программу: "
                    + program);
            }
        }
    }

    private void warnUnknown(Set<String> scenarioIds, Set<String> programs) {
        for (String id : scenarioIds) {
            if (!registrations.containsKey(id)) {
                log.warn("Сценарий {} из выборки не зарегистрирован", id);
            }
        }
        for (String program : programs) {
            if (!catalog.contains(program)) {
                log.warn("Программа {} из выборки отсутствует в каталоге", program);
            }
        }
    }

    private record Registration(AttackScenario scenario, Set<String> programs, boolean enabled) {

        boolean appliesTo(String programName) {
            return programs.contains("*") || programs.contains(programName);
        }
    }
}
