package com.vtb.auditor.chain;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * JSON-RPC ответ с полем error
 */
public class RpcErrorException extends ChainClientException {

    /**
     * Узел отстает от кластера, запрос имеет смысл повторить
     */
    public static final int NODE_UNHEALTHY = -32005;
    /**
     * Preflight-симуляция sendTransaction завершилась ошибкой, в data лежат err и logs
     */
    public static final int SEND_TRANSACTION_PREFLIGHT_FAILURE = -32002;

    private final int code;
    private final transient JsonNode data;

    public RpcErrorException(String method, int code, String message, JsonNode data) {
        super("RPC " + method + " вернул ошибку " + code + ": " + message, code == NODE_UNHEALTHY);
        this.code = code;
        this.data = data;
    }

    public int getCode() {
        return code;
    }

    public JsonNode getData() {
        return data;
    }
}
