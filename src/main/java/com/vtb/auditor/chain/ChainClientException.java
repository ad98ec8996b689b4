package com.vtb.auditor.chain;

/**
 * Ошибка обращения к RPC узлу (сеть, HTTP статус, JSON-RPC error)
 */
public class ChainClientException extends RuntimeException {

    private final boolean retryable;

    public ChainClientException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public ChainClientException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
