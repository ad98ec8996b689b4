package com.vtb.auditor.simulation;

import com.vtb.auditor.chain.ChainClient;
import com.vtb.auditor.chain.CommittingChainClient;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Выбор симулятора. Committing-режим требует явного подтверждения вызывающего кода.
 */
@Slf4j
public final class SimulatorFactory {

    private SimulatorFactory() {
    }

    public static TransactionSimulator create(SimulationMode mode, ChainClient client,
                                              boolean commitConfirmed, Duration confirmTimeout) {
        if (mode == SimulationMode.DRY_RUN) {
            return new DryRunSimulator(client);
        }
        if (!commitConfirmed) {
            throw new IllegalStateException("Режим committing отправляет транзакции в сеть "
                + "и требует явного подтверждения");
        }
        if (!(client instanceof CommittingChainClient committing)) {
            throw new IllegalStateException("Клиент " + client.endpoint() + " не поддерживает отправку транзакций");
        }
        log.warn("ВНИМАНИЕ: включен committing-режим, транзакции атак будут отправлены на {}", client.endpoint());
        return new CommittingSimulator(committing, confirmTimeout);
    }
}
