package com.vtb.auditor.chain;

import java.util.List;
import java.util.Map;

/**
 * Доступ к кластеру только на чтение и симуляцию
 */
public interface ChainClient {

    AccountInfo getAccountInfo(String address);

    /**
     * Значение null в карте - аккаунт не существует
     */
    Map<String, AccountInfo> getMultipleAccounts(List<String> addresses);

    List<AccountInfo> getProgramAccounts(String programId);

    RpcSimulationResult simulateTransaction(byte[] serializedTransaction, List<String> postAccounts);

    byte[] getLatestBlockhash();

    boolean isHealthy();

    String endpoint();
}
