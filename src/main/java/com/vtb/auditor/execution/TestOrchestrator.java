package com.vtb.auditor.execution;

import com.vtb.auditor.config.AuditorConfig;
import com.vtb.auditor.models.AttackCategory;
import com.vtb.auditor.models.TestResult;
import com.vtb.auditor.models.TestStatus;
import com.vtb.auditor.models.TestSuiteReport;
import com.vtb.auditor.reports.ReportAggregator;
import com.vtb.auditor.scenario.ScenarioLibrary;
import com.vtb.auditor.scenario.ScenarioPair;
import com.vtb.auditor.simulation.ScenarioEnvironmentException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Последовательный прогон сценариев по каталогу программ.
 * Каждая единица выполняется на отдельном рабочем потоке только ради таймаута,
 * следующая не стартует, пока предыдущая не завершилась.
 */
@Slf4j
public class TestOrchestrator {

    static final String INFRASTRUCTURE_TARGET = "cluster";

    private final ScenarioLibrary library;
    private final ScenarioExecutor executor;
    private final List<InfrastructureCheck> checks;
    private final ReportAggregator aggregator;
    private final OrchestratorSettings settings;
    private final Clock clock;

    public TestOrchestrator(ScenarioLibrary library, ScenarioExecutor executor, List<InfrastructureCheck> checks,
                            ReportAggregator aggregator, AuditorConfig.Orchestrator config, Clock clock) {
        this.library = library;
        this.executor = executor;
        this.checks = checks != null ? List.copyOf(checks) : List.of();
        this.aggregator = aggregator;
        this.settings = new OrchestratorSettings(config);
        this.clock = clock;
    }

    public TestSuiteReport runSuite(SuiteSelection selection) {
        return runSuite(selection, TestResultListener.NONE, SuiteCancellation.never());
    }

    public TestSuiteReport runSuite(SuiteSelection selection, TestResultListener listener,
                                    SuiteCancellation cancellation) {
        if (selection == null) {
            throw new IllegalArgumentException("SuiteSelection не может быть null");
        }
        TestResultListener notify = listener != null ? listener : TestResultListener.NONE;
        SuiteCancellation cancel = cancellation != null ? cancellation : SuiteCancellation.never();

        Instant startedAt = clock.instant();
        long started = System.nanoTime();
        List<WorkItem> items = plan(selection);
        log.info("Старт прогона: {} единиц (задержка {} мс, таймаут {} с)",
            items.size(), settings.delayMs(), settings.scenarioTimeoutSec());

        List<TestResult> results = new ArrayList<>();
        ExecutorService worker = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "scenario-worker");
            thread.setDaemon(true);
            return thread;
        });
        try {
            int executedAttacks = 0;
            boolean anyExecuted = false;
            String haltReason = null;
            for (WorkItem item : items) {
                TestResult result;
                if (haltReason == null && cancel.isCancelled()) {
                    haltReason = "Run cancelled before this scenario started";
                    log.warn("Прогон отменен, оставшиеся сценарии будут пропущены");
                }
                if (haltReason != null) {
                    result = skipped(item, haltReason);
                } else if (item.attack() && settings.maxScenarios() > 0 && executedAttacks >= settings.maxScenarios()) {
                    result = skipped(item, "Scenario limit of " + settings.maxScenarios() + " reached");
                } else {
                    if (anyExecuted && !pause()) {
                        haltReason = "Run interrupted before this scenario started";
                        result = skipped(item, haltReason);
                    } else {
                        anyExecuted = true;
                        if (item.attack()) {
                            executedAttacks++;
                        }
                        Execution execution = execute(worker, item);
                        result = execution.result();
                        haltReason = execution.haltReason();
                    }
                }
                results.add(result);
                publish(notify, result, results.size(), items.size());
            }
        } finally {
            shutdown(worker);
        }

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        return aggregator.aggregate(results, startedAt, elapsedMs);
    }

    private List<WorkItem> plan(SuiteSelection selection) {
        List<WorkItem> items = new ArrayList<>();
        if (selection.includesInfrastructure()) {
            for (InfrastructureCheck check : checks) {
                items.add(new WorkItem(check.id(), check.name(), AttackCategory.INFRASTRUCTURE,
                    check.targetProgram() != null ? check.targetProgram() : INFRASTRUCTURE_TARGET,
                    false, check::run));
            }
        }
        if (!selection.selectsNoAttacks()) {
            for (ScenarioPair pair : library.plan(selection.categoryFilter(), selection.programFilter(),
                selection.scenarioFilter())) {
                items.add(new WorkItem(pair.scenario().getId(), pair.scenario().getName(),
                    pair.scenario().getCategory(), pair.target().getName(), true, () -> executor.execute(pair)));
            }
        }
        return items;
    }

    private Execution execute(ExecutorService worker, WorkItem item) {
        log.debug("Запуск {} -> {}", item.id(), item.program());
        long start = System.nanoTime();
        Future<ScenarioOutcome> future = worker.submit(item.task());
        try {
            ScenarioOutcome outcome = future.get(settings.scenarioTimeoutSec(), TimeUnit.SECONDS);
            TestResult result = completed(item, outcome, elapsedSince(start));
            if (!result.isPassed()) {
                log.warn("{} -> {}: {}", item.id(), item.program(), result.getDetails());
            }
            return new Execution(result, null);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.error("{} -> {} превысил таймаут {} с", item.id(), item.program(), settings.scenarioTimeoutSec());
            TestResult result = errored(item, "Scenario timed out after " + settings.scenarioTimeoutSec() + " s",
                elapsedSince(start));
            return new Execution(result, drain(worker) ? null
                : "Previous scenario did not terminate after its timeout");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof ScenarioEnvironmentException environment) {
                log.warn("{} -> {}: {}", item.id(), item.program(), environment.getMessage());
            } else {
                log.error("{} -> {} завершился с ошибкой", item.id(), item.program(), cause);
            }
            return new Execution(errored(item, describe(cause), elapsedSince(start)), null);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            TestResult result = errored(item, "Interrupted while waiting for the scenario", elapsedSince(start));
            return new Execution(result, "Run interrupted");
        }
    }

    /**
     * Дождаться, пока рабочий поток освободится после отмененной задачи
     */
    private boolean drain(ExecutorService worker) {
        try {
            worker.submit(() -> { }).get(settings.drainTimeoutSec(), TimeUnit.SECONDS);
            return true;
        } catch (TimeoutException e) {
            log.error("Рабочий поток не освободился за {} с, оставшиеся сценарии будут пропущены",
                settings.drainTimeoutSec());
            return false;
        } catch (ExecutionException e) {
            log.error("Ошибка при ожидании рабочего потока", e);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private boolean pause() {
        if (settings.delayMs() <= 0) {
            return true;
        }
        try {
            Thread.sleep(settings.delayMs());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Ожидание между сценариями прервано");
            return false;
        }
    }

    private void publish(TestResultListener listener, TestResult result, int completed, int total) {
        try {
            listener.onResult(result, completed, total);
        } catch (RuntimeException e) {
            log.warn("Слушатель результатов завершился с ошибкой", e);
        }
    }

    private TestResult completed(WorkItem item, ScenarioOutcome outcome, long elapsedMs) {
        TestResult.TestResultBuilder builder = base(item, elapsedMs)
            .status(outcome.passed() ? TestStatus.PASSED : TestStatus.FAILED)
            .passed(outcome.passed())
            .details(outcome.details());
        if (outcome instanceof AttackOutcome attack) {
            builder.vulnerabilityFound(attack.vulnerabilityFound())
                .severity(attack.vulnerabilityFound() ? attack.report().getSeverity() : null)
                .confidence(attack.vulnerabilityFound() ? attack.report().getConfidence() : 0)
                .vulnerabilityReport(attack.report());
        }
        return builder.build();
    }

    private TestResult errored(WorkItem item, String error, long elapsedMs) {
        return base(item, elapsedMs)
            .status(TestStatus.ERROR)
            .passed(false)
            .error(error)
            .details("Scenario could not be evaluated")
            .build();
    }

    private TestResult skipped(WorkItem item, String reason) {
        return base(item, 0)
            .status(TestStatus.SKIPPED)
            .passed(false)
            .details(reason)
            .build();
    }

    private TestResult.TestResultBuilder base(WorkItem item, long elapsedMs) {
        return TestResult.builder()
            .scenarioId(item.id())
            .scenarioName(item.name())
            .category(item.category())
            .targetProgram(item.program())
            .executionTimeMs(elapsedMs)
            .timestamp(clock.instant());
    }

    private static String describe(Throwable cause) {
        String message = cause.getMessage();
        return cause.getClass().getSimpleName() + (message != null ? ": " + message : "");
    }

    private static long elapsedSince(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private static void shutdown(ExecutorService worker) {
        worker.shutdown();
        try {
            if (!worker.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Рабочий поток сценариев не завершился, принудительное закрытие");
                worker.shutdownNow();
            }
        } catch (InterruptedException e) {
            worker.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private record WorkItem(String id, String name, AttackCategory category, String program,
                            boolean attack, Callable<ScenarioOutcome> task) {
    }

    /**
     * haltReason != null - оставшиеся единицы пропускаются
     */
    private record Execution(TestResult result, String haltReason) {
    }
}
