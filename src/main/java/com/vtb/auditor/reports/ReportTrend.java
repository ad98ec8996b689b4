package com.vtb.auditor.reports;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Сравнение последнего прогона с предыдущим
 */
@Value
@Builder
public class ReportTrend {
    Instant previousDate;
    Instant currentDate;
    int previousScore;
    int currentScore;
    /**
     * Ключи вида scenarioId@program, которые раньше проходили, а теперь нет
     */
    @Builder.Default
    List<String> newlyFailing = new ArrayList<>();
    @Builder.Default
    List<String> newlyFixed = new ArrayList<>();

    public int scoreDelta() {
        return currentScore - previousScore;
    }

    public boolean isRegression() {
        return scoreDelta() < 0 || !newlyFailing.isEmpty();
    }
}
