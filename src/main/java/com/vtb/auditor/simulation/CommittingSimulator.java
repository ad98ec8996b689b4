package com.vtb.auditor.simulation;

import com.fasterxml.jackson.databind.JsonNode;
import com.vtb.auditor.chain.CandidateTransaction;
import com.vtb.auditor.chain.CommittingChainClient;
import com.vtb.auditor.chain.RpcErrorException;
import com.vtb.auditor.chain.RpcSimulationResult;
import com.vtb.auditor.chain.TransactionSerializer;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * "Агрессивный" режим: транзакция реально отправляется и подтверждается.
 * Создается только через {@link SimulatorFactory} с явным подтверждением.
 */
@Slf4j
public class CommittingSimulator implements TransactionSimulator {

    private final CommittingChainClient client;
    private final Duration confirmTimeout;

    CommittingSimulator(CommittingChainClient client, Duration confirmTimeout) {
        this.client = client;
        this.confirmTimeout = confirmTimeout;
    }

    @Override
    public SimulationOutcome simulate(CandidateTransaction transaction, List<String> watchAccounts) {
        byte[] serialized = TransactionSerializer.serialize(transaction, client.getLatestBlockhash());
        long start = System.nanoTime();
        RpcSimulationResult result;
        try {
            String signature = client.sendTransaction(serialized);
            log.warn("Транзакция атаки {} отправлена в сеть: {}", transaction.getLabel(), signature);
            result = client.confirmTransaction(signature, confirmTimeout);
        } catch (RpcErrorException e) {
            if (e.getCode() != RpcErrorException.SEND_TRANSACTION_PREFLIGHT_FAILURE || e.getData() == null) {
                throw e;
            }
            result = fromPreflight(e.getData());
        }
        long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        ErrorDescriptor error = SimulationErrorClassifier.classify(result.getErr(), result.getLogs());
        return SimulationOutcome.builder()
            .succeededWithoutError(error == null)
            .resourceUnitsConsumed(result.getUnitsConsumed())
            .logs(result.getLogs())
            .error(error)
            .postAccounts(null)
            .durationMs(durationMs)
            .mode(SimulationMode.COMMITTING)
            .build();
    }

    private static RpcSimulationResult fromPreflight(JsonNode data) {
        List<String> logs = new ArrayList<>();
        data.path("logs").forEach(line -> logs.add(line.asText()));
        JsonNode err = data.get("err");
        return RpcSimulationResult.builder()
            .err(err == null || err.isNull() ? null : err)
            .logs(logs)
            .unitsConsumed(data.hasNonNull("unitsConsumed") ? data.get("unitsConsumed").asLong() : null)
            .build();
    }

    @Override
    public SimulationMode mode() {
        return SimulationMode.COMMITTING;
    }
}
