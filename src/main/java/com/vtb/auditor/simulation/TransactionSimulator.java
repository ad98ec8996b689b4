package com.vtb.auditor.simulation;

import com.vtb.auditor.chain.CandidateTransaction;

import java.util.List;

public interface TransactionSimulator {

    /**
     * Исполнить транзакцию и вернуть логи, ошибку и пост-состояние аккаунтов watchAccounts.
     *
     * @throws com.vtb.auditor.chain.ChainClientException при сбое RPC после повторов
     */
    SimulationOutcome simulate(CandidateTransaction transaction, List<String> watchAccounts);

    SimulationMode mode();
}
