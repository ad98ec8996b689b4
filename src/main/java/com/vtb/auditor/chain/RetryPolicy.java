package com.vtb.auditor.chain;

import com.vtb.auditor.config.AuditorConfig;
import lombok.extern.slf4j.Slf4j;

/**
 * Повтор RPC вызовов с экспоненциальной задержкой.
 * Повторяются только ошибки, помеченные как retryable.
 */
@Slf4j
public class RetryPolicy {

    @FunctionalInterface
    public interface RpcCall<T> {
        T execute();
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final int maxAttempts;
    private final long initialBackoffMs;
    private final long maxBackoffMs;
    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts, long initialBackoffMs, long maxBackoffMs, Sleeper sleeper) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.initialBackoffMs = Math.max(0, initialBackoffMs);
        this.maxBackoffMs = Math.max(this.initialBackoffMs, maxBackoffMs);
        this.sleeper = sleeper;
    }

    public static RetryPolicy fromConfig(AuditorConfig.Rpc rpc) {
        return new RetryPolicy(rpc.getMaxAttempts(), rpc.getInitialBackoffMs(), rpc.getMaxBackoffMs(), Thread::sleep);
    }

    public static RetryPolicy none() {
        return new RetryPolicy(1, 0, 0, Thread::sleep);
    }

    public <T> T execute(String operation, RpcCall<T> call) {
        long backoff = initialBackoffMs;
        ChainClientException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return call.execute();
            } catch (ChainClientException e) {
                last = e;
                if (!e.isRetryable() || attempt == maxAttempts) {
                    throw e;
                }
                log.warn("RPC {} не удался (попытка {}/{}): {}. Повтор через {} мс",
                    operation, attempt, maxAttempts, e.getMessage(), backoff);
                try {
                    sleeper.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new ChainClientException("RPC " + operation + " прерван", ie, false);
                }
                backoff = Math.min(maxBackoffMs, Math.max(1, backoff * 2));
            }
        }
        throw last;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
