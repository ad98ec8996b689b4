package com.vtb.auditor.execution;

import com.vtb.auditor.models.TestResult;

/**
 * Уведомление о каждом завершенном результате, в порядке выполнения
 */
@FunctionalInterface
public interface TestResultListener {

    TestResultListener NONE = (result, completed, total) -> { };

    void onResult(TestResult result, int completed, int total);
}
