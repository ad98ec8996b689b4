package com.vtb.auditor.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vtb.auditor.config.AuditorConfig;
import com.vtb.auditor.core.AuditEngine;
import com.vtb.auditor.core.RegistrationException;
import com.vtb.auditor.execution.SuiteCancellation;
import com.vtb.auditor.execution.SuiteSelection;
import com.vtb.auditor.execution.TestResultListener;
import com.vtb.auditor.integration.CICDIntegration;
import com.vtb.auditor.models.AttackCategory;
import com.vtb.auditor.models.Severity;
import com.vtb.auditor.models.TestResult;
import com.vtb.auditor.models.TestSuiteReport;
import com.vtb.auditor.reports.ExecutiveSummaryGenerator;
import com.vtb.auditor.reports.ReportPublisher;
import com.vtb.auditor.reports.ReportRepository;
import com.vtb.auditor.scenario.AttackScenario;
import com.vtb.auditor.simulation.SimulationMode;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Главная CLI команда аудитора Solana-программ
 */
@Slf4j
@Command(
    name = "chain-auditor",
    mixinStandardHelpOptions = true,
    version = "VTB Solana Security Auditor 1.0.0",
    description = """

        VTB Solana Security Auditor

        Симуляция атак на Solana-программы и обнаружение уязвимостей

        Возможности:
          • Безопасная симуляция атак (simulateTransaction)
          • Снимки состояния аккаунтов до и после атаки
          • Правила обнаружения и оценка уверенности
          • Отчеты JSON и Markdown, сравнение с прошлым прогоном
          • Интеграция с CI/CD

        """
)
public class MainCommand implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Путь к YAML конфигурации (по умолчанию: auditor-config.yaml из classpath)"
    )
    private Path configPath;

    @Option(
        names = {"--cluster"},
        description = "Кластер: localnet, devnet, testnet, mainnet-beta"
    )
    private String cluster;

    @Option(
        names = {"--rpc-url"},
        description = "Явный RPC endpoint, важнее --cluster"
    )
    private String rpcUrl;

    @Option(
        names = {"--category"},
        split = ",",
        description = "Категории атак (access_control, overflow, reentrancy, ...)"
    )
    private List<String> categories;

    @Option(
        names = {"--program"},
        split = ",",
        description = "Имена программ из каталога"
    )
    private List<String> programs;

    @Option(
        names = {"--scenario"},
        split = ",",
        description = "Идентификаторы сценариев"
    )
    private List<String> scenarioIds;

    @Option(
        names = {"--self-check"},
        description = "Выполнить самопроверки инфраструктуры перед атаками"
    )
    private boolean selfCheck = false;

    @Option(
        names = {"-o", "--output"},
        description = "Директория для сохранения отчетов (по умолчанию из конфигурации)"
    )
    private String outputDir;

    @Option(
        names = {"--list-scenarios"},
        description = "Показать зарегистрированные сценарии и выйти"
    )
    private boolean listScenarios = false;

    @Option(
        names = {"--list-rules"},
        description = "Вывести каталог правил обнаружения в JSON и выйти"
    )
    private boolean listRules = false;

    @Option(
        names = {"--fail-on-vulnerability"},
        description = "Код выхода 1 при любой найденной уязвимости (для CI/CD)"
    )
    private boolean failOnVulnerability = false;

    @Option(
        names = {"--ci"},
        description = "Режим CI/CD (краткий вывод + exit codes)"
    )
    private boolean ciMode = false;

    @Option(
        names = {"--fee-payer"},
        description = "Keypair-файл Solana CLI с пополненным аккаунтом для комиссий симуляций"
    )
    private Path feePayerKeypair;

    @Option(
        names = {"--aggressive"},
        description = "Отправлять транзакции атак в сеть (committing). Требует --i-understand-this-commits"
    )
    private boolean aggressive = false;

    @Option(
        names = {"--i-understand-this-commits"},
        description = "Подтверждение, что транзакции атак будут реально отправлены"
    )
    private boolean commitConfirmed = false;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        printBanner();

        AuditEngine engine;
        SuiteSelection selection;
        try {
            AuditorConfig config = configPath != null ? AuditorConfig.load(configPath) : AuditorConfig.load();
            applyOverrides(config);
            if (aggressive && !commitConfirmed) {
                log.error("--aggressive отправляет транзакции в сеть, добавьте --i-understand-this-commits");
                return CICDIntegration.EXIT_CONFIG_ERROR;
            }
            engine = AuditEngine.create(config, commitConfirmed);
            selection = buildSelection();
        } catch (RegistrationException | IllegalStateException | IllegalArgumentException e) {
            log.error("Ошибка конфигурации: {}", e.getMessage(), e);
            return CICDIntegration.EXIT_CONFIG_ERROR;
        }

        if (listScenarios) {
            printScenarios(engine);
            return CICDIntegration.EXIT_OK;
        }
        if (listRules) {
            return printRules(engine);
        }

        try {
            log.info("Запуск аудита на {} ({})", engine.getClient().endpoint(), engine.getMode().getConfigName());
            TestResultListener listener = ciMode ? TestResultListener.NONE : new ConsoleProgressListener(System.out);
            TestSuiteReport report = engine.runSuite(selection, listener, SuiteCancellation.never());

            Path output = Paths.get(outputDir != null ? outputDir : engine.getConfig().getReports().getDirectory());
            saveReports(report, output, engine.getConfig().getReports().getKeepLast());

            if (ciMode) {
                CICDIntegration.printCISummary(report);
                CICDIntegration.printGitHubAnnotations(report);
            } else {
                printDetailedResults(report, output);
            }
            return CICDIntegration.getExitCode(report, failOnVulnerability);
        } catch (Exception e) {
            log.error("Ошибка при аудите: {}", e.getMessage(), e);
            return 1;
        }
    }

    private void applyOverrides(AuditorConfig config) {
        if (cluster != null && !cluster.isBlank()) {
            config.getCluster().setName(cluster.trim());
            if (rpcUrl == null) {
                config.getCluster().setRpcUrl(null);
            }
        }
        if (rpcUrl != null && !rpcUrl.isBlank()) {
            config.getCluster().setRpcUrl(rpcUrl.trim());
        }
        if (feePayerKeypair != null) {
            config.getSimulator().setFeePayerKeypair(feePayerKeypair.toString());
        }
        if (aggressive) {
            config.getSimulator().setMode(SimulationMode.COMMITTING.getConfigName());
        }
        if (outputDir != null && !outputDir.isBlank()) {
            config.getReports().setDirectory(outputDir);
        }
    }

    private SuiteSelection buildSelection() {
        Set<AttackCategory> categoryFilter = null;
        if (categories != null) {
            categoryFilter = EnumSet.noneOf(AttackCategory.class);
            for (String category : categories) {
                categoryFilter.add(AttackCategory.fromWireName(category));
            }
        }
        return SuiteSelection.builder()
            .categories(categoryFilter)
            .programs(programs != null ? new LinkedHashSet<>(programs) : null)
            .scenarioIds(scenarioIds != null ? new LinkedHashSet<>(scenarioIds) : null)
            .infrastructureChecks(selfCheck)
            .build();
    }

    private void saveReports(TestSuiteReport report, Path output, int keepLast) throws IOException {
        new ReportPublisher(new ReportRepository(output)).publish(report, keepLast);
    }

    private void printScenarios(AuditEngine engine) {
        System.out.println("Сценарии атак (" + engine.getScenarios().size() + "):");
        for (AttackScenario scenario : engine.getScenarios().scenarios()) {
            System.out.printf("  %-36s %-14s %-8s %s%n", scenario.getId(), scenario.getCategory().getWireName(),
                scenario.getSeverity().wireName(), scenario.getName());
        }
    }

    private int printRules(AuditEngine engine) {
        ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        try {
            System.out.println(mapper.writeValueAsString(engine.getRules().rules()));
            return CICDIntegration.EXIT_OK;
        } catch (IOException e) {
            log.error("Не удалось сериализовать каталог правил: {}", e.getMessage(), e);
            return 1;
        }
    }

    /**
     * Вывести детальные результаты
     */
    private void printDetailedResults(TestSuiteReport report, Path output) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("VTB SOLANA SECURITY AUDIT REPORT");
        System.out.println("=".repeat(80));
        System.out.println();
        System.out.println("Дата: " + report.getSummary().getTestDate());
        System.out.println("Время прогона: " + report.getSummary().getExecutionTimeMs() + " мс");
        System.out.println("Оценка безопасности: " + report.getSecurityScore() + "/100 (риск "
            + ExecutiveSummaryGenerator.riskLevel(report) + ")");
        System.out.println();

        System.out.println("СТАТИСТИКА:");
        System.out.println("   Всего тестов: " + report.getSummary().getTotalTests());
        System.out.println("   Пройдено:     " + report.getSummary().getPassed());
        System.out.println("   Провалено:    " + report.getSummary().getFailed()
            + " (ошибок: " + report.getSummary().getErrors() + ")");
        System.out.println("   Пропущено:    " + report.getSummary().getSkipped());
        System.out.println();
        for (Severity severity : Severity.values()) {
            System.out.printf("%-9s %d%n", severity.name() + ":", report.countVulnerabilities(severity));
        }
        System.out.println();

        List<TestResult> vulnerable = report.getResults().stream()
            .filter(TestResult::isVulnerabilityFound)
            .limit(5)
            .toList();
        if (!vulnerable.isEmpty()) {
            System.out.println("ТОП УЯЗВИМОСТИ:");
            for (TestResult result : vulnerable) {
                System.out.printf("   [%s] %s%n", result.getSeverity().name(), result.getScenarioName());
                System.out.printf("      → %s, confidence=%d%%%n", result.getTargetProgram(), result.getConfidence());
            }
            System.out.println();
        }

        if (!report.getRecommendations().isEmpty()) {
            System.out.println("РЕКОМЕНДАЦИИ:");
            report.getRecommendations().forEach(recommendation -> System.out.println("   - " + recommendation));
            System.out.println();
        }

        System.out.println("Отчеты сохранены в: " + output);
        System.out.println("=".repeat(80));
        System.out.println();
    }

    /**
     * Вывести баннер
     */
    private void printBanner() {
        if (ciMode) return;  // Не показываем в CI режиме

        System.out.println("""

            ╔═══════════════════════════════════════════════════════════╗
            ║                                                           ║
            ║     VTB Solana Security Auditor v1.0.0                    ║
            ║                                                           ║
            ║     Симуляция атак на Solana-программы                    ║
            ║     • Безопасный dry-run по умолчанию                     ║
            ║     • Правила обнаружения уязвимостей                     ║
            ║                                                           ║
            ╚═══════════════════════════════════════════════════════════╝

            """);
    }
}
