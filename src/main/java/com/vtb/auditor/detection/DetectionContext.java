package com.vtb.auditor.detection;

import com.vtb.auditor.chain.CandidateTransaction;
import com.vtb.auditor.simulation.ErrorDescriptor;
import com.vtb.auditor.snapshot.StateDiff;
import com.vtb.auditor.snapshot.StateSnapshot;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Все, что правила детектора видят об одном выполнении сценария.
 * Собирается один раз и только читается.
 */
@Value
@Builder(toBuilder = true)
public class DetectionContext {
    StateSnapshot preState;
    StateSnapshot postState;
    CandidateTransaction transaction;
    @Builder.Default
    List<String> logs = new ArrayList<>();
    long executionTimeMs;
    long resourceUnitsConsumed;
    ErrorDescriptor simulationError;
    StateDiff diff;

    /**
     * Пустой контекст для проверки правил при регистрации
     */
    public static DetectionContext baseline() {
        Instant epoch = Instant.EPOCH;
        return DetectionContext.builder()
            .preState(StateSnapshot.empty("baseline-pre", epoch))
            .postState(StateSnapshot.empty("baseline-post", epoch))
            .transaction(CandidateTransaction.builder().label("baseline").build())
            .diff(StateDiff.builder().build())
            .build();
    }

    public int instructionCount() {
        return transaction != null ? transaction.instructionCount() : 0;
    }
}
