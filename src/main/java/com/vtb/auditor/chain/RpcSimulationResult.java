package com.vtb.auditor.chain;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Ответ simulateTransaction / getTransaction в нейтральном виде.
 * err - сырое поле ошибки из ответа (null при успехе).
 */
@Value
@Builder
public class RpcSimulationResult {
    JsonNode err;
    @Builder.Default
    List<String> logs = new ArrayList<>();
    Long unitsConsumed;
    /**
     * Пост-состояние запрошенных аккаунтов; значение null - аккаунт не существует
     */
    Map<String, AccountInfo> postAccounts;
    String signature;

    public boolean isSuccess() {
        return err == null || err.isNull();
    }
}
