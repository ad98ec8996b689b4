package com.vtb.auditor.execution;

import com.vtb.auditor.models.AttackCategory;
import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * Что запускать в прогоне. null в фильтре означает "все", пустой набор означает "ничего".
 */
@Value
@Builder
public class SuiteSelection {
    Set<AttackCategory> categories;
    Set<String> programs;
    Set<String> scenarioIds;
    /**
     * Самопроверки инфраструктуры перед атаками
     */
    boolean infrastructureChecks;

    public static SuiteSelection all() {
        return SuiteSelection.builder().build();
    }

    public static SuiteSelection none() {
        return SuiteSelection.builder()
            .scenarioIds(Set.of())
            .build();
    }

    /**
     * Хотя бы один фильтр явно пуст, атаки не выбираются
     */
    public boolean selectsNoAttacks() {
        return isExplicitlyEmpty(categories) || isExplicitlyEmpty(programs) || isExplicitlyEmpty(scenarioIds);
    }

    public boolean includesInfrastructure() {
        return infrastructureChecks || (categories != null && categories.contains(AttackCategory.INFRASTRUCTURE));
    }

    Set<AttackCategory> categoryFilter() {
        return categories != null ? categories : Set.of();
    }

    Set<String> programFilter() {
        return programs != null ? programs : Set.of();
    }

    Set<String> scenarioFilter() {
        return scenarioIds != null ? scenarioIds : Set.of();
    }

    private static boolean isExplicitlyEmpty(Set<?> filter) {
        return filter != null && filter.isEmpty();
    }
}
