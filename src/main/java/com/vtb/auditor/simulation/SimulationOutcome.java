package com.vtb.auditor.simulation;

import com.vtb.auditor.chain.AccountInfo;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Результат исполнения транзакции-кандидата
 */
@Value
@Builder
public class SimulationOutcome {
    boolean succeededWithoutError;
    Long resourceUnitsConsumed;
    @Builder.Default
    List<String> logs = new ArrayList<>();
    ErrorDescriptor error;
    /**
     * null - пост-состояние не получено, его нужно перечитать
     */
    Map<String, AccountInfo> postAccounts;
    long durationMs;
    SimulationMode mode;

    public boolean isRejectedByProgram() {
        return error != null && error.isProgramRejection();
    }

    public boolean isEnvironmentFailure() {
        return error != null && error.getKind() == ErrorDescriptor.Kind.ENVIRONMENT;
    }
}
