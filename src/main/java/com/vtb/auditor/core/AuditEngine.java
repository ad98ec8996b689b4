package com.vtb.auditor.core;

import com.vtb.auditor.catalog.TargetCatalog;
import com.vtb.auditor.catalog.TargetCatalogLoader;
import com.vtb.auditor.catalog.TargetProgram;
import com.vtb.auditor.chain.ChainClient;
import com.vtb.auditor.chain.KeypairLoader;
import com.vtb.auditor.chain.SignerIdentity;
import com.vtb.auditor.chain.SolanaRpcClient;
import com.vtb.auditor.config.AuditorConfig;
import com.vtb.auditor.detection.DetectionEngine;
import com.vtb.auditor.detection.DetectionRuleRegistry;
import com.vtb.auditor.execution.ScenarioExecutor;
import com.vtb.auditor.execution.SuiteCancellation;
import com.vtb.auditor.execution.SuiteSelection;
import com.vtb.auditor.execution.TestOrchestrator;
import com.vtb.auditor.execution.TestResultListener;
import com.vtb.auditor.execution.checks.StandardChecks;
import com.vtb.auditor.heuristics.VulnerabilityScorer;
import com.vtb.auditor.models.TestSuiteReport;
import com.vtb.auditor.reports.ReportAggregator;
import com.vtb.auditor.scenario.ScenarioContext;
import com.vtb.auditor.scenario.ScenarioLibrary;
import com.vtb.auditor.scenario.attacks.StandardScenarios;
import com.vtb.auditor.simulation.SimulationMode;
import com.vtb.auditor.simulation.SimulatorFactory;
import com.vtb.auditor.simulation.TransactionSimulator;
import com.vtb.auditor.snapshot.AccountDecoder;
import com.vtb.auditor.snapshot.LayoutAccountDecoder;
import com.vtb.auditor.snapshot.StateSnapshotService;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Сборка всех компонентов аудита из одной конфигурации.
 * Ошибки регистрации сценариев и правил возникают здесь, до первого запроса к сети.
 */
@Slf4j
public class AuditEngine {

    static final String ADMIN_ACCOUNT = "admin";

    private final AuditorConfig config;
    private final ChainClient client;
    private final TargetCatalog catalog;
    private final ScenarioLibrary scenarios;
    private final DetectionRuleRegistry rules;
    private final SimulationMode mode;
    private final TestOrchestrator orchestrator;

    /**
     * Движок поверх реального RPC-клиента кластера из конфигурации
     *
     * @param commitConfirmed явное согласие на отправку транзакций в committing-режиме
     */
    public static AuditEngine create(AuditorConfig config, boolean commitConfirmed) {
        config.ensureDefaults();
        String keypair = config.getSimulator().getFeePayerKeypair();
        SignerIdentity feePayer = null;
        if (keypair != null && !keypair.isBlank()) {
            feePayer = KeypairLoader.load(Paths.get(keypair.trim()));
        } else {
            log.warn("simulator.feePayerKeypair не задан: комиссии платит новый атакующий ключ без баланса, "
                + "кластер ответит AccountNotFound и сценарии завершатся ошибкой");
        }
        return new AuditEngine(config, new SolanaRpcClient(config.getCluster(), config.getRpc()),
            SignerIdentity.generate(), feePayer, Clock.systemUTC(), commitConfirmed);
    }

    public AuditEngine(AuditorConfig config, ChainClient client, SignerIdentity attacker,
                       Clock clock, boolean commitConfirmed) {
        this(config, client, attacker, null, clock, commitConfirmed);
    }

    /**
     * @param feePayer пополненный ключ для комиссий, null - комиссии платит атакующий
     */
    public AuditEngine(AuditorConfig config, ChainClient client, SignerIdentity attacker,
                       SignerIdentity feePayer, Clock clock, boolean commitConfirmed) {
        config.ensureDefaults();
        if (feePayer != null && feePayer.address().equals(config.getKnownAccounts().get(ADMIN_ACCOUNT))) {
            throw new IllegalStateException("Fee payer совпадает с admin: подпись admin сделает атаки легитимными");
        }
        if (feePayer != null && feePayer.address().equals(attacker.address())) {
            throw new IllegalStateException("Fee payer должен отличаться от ключа атакующего");
        }
        this.config = config;
        this.client = client;
        this.mode = SimulationMode.fromConfig(config.getSimulator().getMode());
        if (mode == SimulationMode.COMMITTING && config.getCluster().isMainnet()) {
            throw new IllegalStateException("Committing-режим запрещен для mainnet");
        }

        this.catalog = TargetCatalogLoader.load(config);
        this.scenarios = StandardScenarios.registerAll(new ScenarioLibrary(catalog));
        this.scenarios.applyOverrides(config.getScenarios());
        this.rules = DetectionRuleRegistry.standard();
        log.info("Зарегистрировано сценариев: {}, правил: {}, программ: {}",
            scenarios.size(), rules.size(), catalog.size());

        StateSnapshotService snapshots = new StateSnapshotService(client, decoders(catalog), clock);
        TransactionSimulator simulator = SimulatorFactory.create(mode, client, commitConfirmed,
            Duration.ofSeconds(config.getRpc().getConfirmTimeoutSec()));
        DetectionEngine engine = new DetectionEngine(rules);
        ScenarioContext context = ScenarioContext.builder()
            .attacker(attacker)
            .feePayer(feePayer)
            .knownAccounts(new LinkedHashMap<>(config.getKnownAccounts()))
            .parameters(new LinkedHashMap<>(config.getParameters()))
            .catalog(catalog)
            .clock(clock)
            .build();
        SignerIdentity payer = context.payer();
        log.info("Атакующий ключ: {}, комиссии платит {} (режим {})",
            attacker.address(), payer.address(), mode.getConfigName());

        ScenarioExecutor executor = new ScenarioExecutor(snapshots, simulator, engine,
            new VulnerabilityScorer(), context);
        this.orchestrator = new TestOrchestrator(scenarios, executor,
            StandardChecks.create(client, catalog, snapshots, engine, payer.address()),
            new ReportAggregator(programAdvisories(catalog)), config.getOrchestrator(), clock);
    }

    public TestSuiteReport runSuite(SuiteSelection selection) {
        return orchestrator.runSuite(selection);
    }

    public TestSuiteReport runSuite(SuiteSelection selection, TestResultListener listener,
                                    SuiteCancellation cancellation) {
        return orchestrator.runSuite(selection, listener, cancellation);
    }

    private static List<AccountDecoder> decoders(TargetCatalog catalog) {
        List<AccountDecoder> decoders = StateSnapshotService.standardDecoders();
        for (TargetProgram target : catalog.all()) {
            for (AuditorConfig.AccountLayout layout : target.getAccountLayouts()) {
                decoders.add(new LayoutAccountDecoder(target.getAddress(), layout));
            }
        }
        return decoders;
    }

    private static Map<String, String> programAdvisories(TargetCatalog catalog) {
        Map<String, String> advisories = new LinkedHashMap<>();
        for (TargetProgram target : catalog.all()) {
            if (target.getAdvisory() != null) {
                advisories.put(target.getName(), target.getAdvisory());
            }
        }
        return advisories;
    }

    public AuditorConfig getConfig() {
        return config;
    }

    public ChainClient getClient() {
        return client;
    }

    public TargetCatalog getCatalog() {
        return catalog;
    }

    public ScenarioLibrary getScenarios() {
        return scenarios;
    }

    public DetectionRuleRegistry getRules() {
        return rules;
    }

    public SimulationMode getMode() {
        return mode;
    }
}
