package com.vtb.auditor.execution;

import com.vtb.auditor.chain.CandidateTransaction;
import com.vtb.auditor.detection.DetectionContext;
import com.vtb.auditor.detection.DetectionEngine;
import com.vtb.auditor.detection.RuleMatch;
import com.vtb.auditor.heuristics.VulnerabilityScorer;
import com.vtb.auditor.models.VulnerabilityReport;
import com.vtb.auditor.scenario.AttackScenario;
import com.vtb.auditor.scenario.ScenarioContext;
import com.vtb.auditor.scenario.ScenarioPair;
import com.vtb.auditor.simulation.ScenarioEnvironmentException;
import com.vtb.auditor.simulation.SimulationOutcome;
import com.vtb.auditor.simulation.TransactionSimulator;
import com.vtb.auditor.snapshot.StateDiff;
import com.vtb.auditor.snapshot.StateSnapshot;
import com.vtb.auditor.snapshot.StateSnapshotService;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Одно выполнение пары (сценарий, программа):
 * снимок до, сборка, симуляция, снимок после, детектор, оценка.
 */
@Slf4j
public class ScenarioExecutor {

    private final StateSnapshotService snapshots;
    private final TransactionSimulator simulator;
    private final DetectionEngine engine;
    private final VulnerabilityScorer scorer;
    private final ScenarioContext context;

    public ScenarioExecutor(StateSnapshotService snapshots, TransactionSimulator simulator,
                            DetectionEngine engine, VulnerabilityScorer scorer, ScenarioContext context) {
        this.snapshots = snapshots;
        this.simulator = simulator;
        this.engine = engine;
        this.scorer = scorer;
        this.context = context;
    }

    /**
     * @throws com.vtb.auditor.chain.InstructionBuildException сценарий не собирается для цели
     * @throws com.vtb.auditor.chain.ChainClientException сбой RPC после повторов
     * @throws ScenarioEnvironmentException симуляция не смогла оценить атаку
     */
    public AttackOutcome execute(ScenarioPair pair) {
        AttackScenario scenario = pair.scenario();
        List<String> watched = scenario.watchedAccounts(pair.target(), context);

        StateSnapshot pre = snapshots.capture("pre " + pair.describe(), watched);
        CandidateTransaction transaction = scenario.build(pair.target(), context);
        log.debug("{}: {} инструкций, {} аккаунтов под наблюдением",
            pair.describe(), transaction.instructionCount(), watched.size());

        SimulationOutcome simulation = simulator.simulate(transaction, watched);
        if (simulation.isEnvironmentFailure()) {
            throw new ScenarioEnvironmentException(simulation.getError());
        }

        StateSnapshot post = snapshots.fromSimulation("post " + pair.describe(), watched,
            simulation.getPostAccounts());
        StateDiff diff = snapshots.diff(pre, post);

        DetectionContext detection = DetectionContext.builder()
            .preState(pre)
            .postState(post)
            .transaction(transaction)
            .logs(simulation.getLogs())
            .executionTimeMs(simulation.getDurationMs())
            .resourceUnitsConsumed(simulation.getResourceUnitsConsumed() != null
                ? simulation.getResourceUnitsConsumed() : 0L)
            .simulationError(simulation.getError())
            .diff(diff)
            .build();
        List<RuleMatch> matches = engine.evaluate(detection);

        if (simulation.isRejectedByProgram()) {
            log.debug("{}: транзакция отвергнута программой ({})", pair.describe(),
                simulation.getError().describe());
            return new AttackOutcome(VulnerabilityReport.clean(scenario.getId()), simulation.getError(),
                matches, diff);
        }
        VulnerabilityReport report = scorer.score(scenario.getId(), matches, transaction);
        return new AttackOutcome(report, null, List.of(), diff);
    }
}
