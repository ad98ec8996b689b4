package com.vtb.auditor.chain;

import java.time.Duration;

/**
 * Клиент с правом отправки транзакций. Используется только committing-режимом.
 */
public interface CommittingChainClient extends ChainClient {

    String sendTransaction(byte[] serializedTransaction);

    /**
     * Дождаться подтверждения и вернуть логи/ошибку исполнения
     */
    RpcSimulationResult confirmTransaction(String signature, Duration timeout);
}
