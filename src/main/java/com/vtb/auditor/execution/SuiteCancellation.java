package com.vtb.auditor.execution;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Флаг отмены прогона. Проверяется только между сценариями.
 */
public class SuiteCancellation {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static SuiteCancellation never() {
        return new SuiteCancellation();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
