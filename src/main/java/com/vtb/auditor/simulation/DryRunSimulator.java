package com.vtb.auditor.simulation;

import com.vtb.auditor.chain.CandidateTransaction;
import com.vtb.auditor.chain.ChainClient;
import com.vtb.auditor.chain.RpcSimulationResult;
import com.vtb.auditor.chain.TransactionSerializer;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Безопасная симуляция через simulateTransaction. Ничего не отправляет в сеть.
 */
@Slf4j
public class DryRunSimulator implements TransactionSimulator {

    // кластер подставляет свежий blockhash (replaceRecentBlockhash)
    private static final byte[] PLACEHOLDER_BLOCKHASH = new byte[32];

    private final ChainClient client;

    public DryRunSimulator(ChainClient client) {
        this.client = client;
    }

    @Override
    public SimulationOutcome simulate(CandidateTransaction transaction, List<String> watchAccounts) {
        byte[] serialized = TransactionSerializer.serialize(transaction, PLACEHOLDER_BLOCKHASH);
        if (TransactionSerializer.exceedsPacketSize(serialized)) {
            log.warn("Транзакция {} превышает лимит пакета: {} байт", transaction.getLabel(), serialized.length);
        }

        long start = System.nanoTime();
        RpcSimulationResult result = client.simulateTransaction(serialized, watchAccounts);
        long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        ErrorDescriptor error = SimulationErrorClassifier.classify(result.getErr(), result.getLogs());
        if (error != null) {
            log.debug("Симуляция {}: {} ({})", transaction.getLabel(), error.describe(), error.getKind());
        }
        return SimulationOutcome.builder()
            .succeededWithoutError(error == null)
            .resourceUnitsConsumed(result.getUnitsConsumed())
            .logs(result.getLogs())
            .error(error)
            .postAccounts(result.getPostAccounts())
            .durationMs(durationMs)
            .mode(SimulationMode.DRY_RUN)
            .build();
    }

    @Override
    public SimulationMode mode() {
        return SimulationMode.DRY_RUN;
    }
}
