package com.vtb.auditor.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Конфигурация аудитора из YAML файла.
 * Адреса программ, шаблоны инструкций и параметры прогона не зашиты в код.
 */
@Slf4j
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class AuditorConfig {

    public static final String DEFAULT_RESOURCE = "auditor-config.yaml";

    private Cluster cluster;
    private Rpc rpc;
    private Orchestrator orchestrator;
    private Simulator simulator;
    private Reports reports;
    private Map<String, String> knownAccounts = new LinkedHashMap<>();
    private Map<String, String> parameters = new LinkedHashMap<>();
    private List<Target> targets = new ArrayList<>();
    private Map<String, ScenarioOverride> scenarios = new LinkedHashMap<>();

    /**
     * Загрузить конфигурацию по умолчанию из classpath
     */
    public static AuditorConfig load() {
        try (InputStream is = AuditorConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (is == null) {
                throw new IllegalStateException(DEFAULT_RESOURCE + " не найден в classpath");
            }
            return read(is);
        } catch (IOException e) {
            throw new IllegalStateException("Ошибка загрузки конфигурации: " + e.getMessage(), e);
        }
    }

    /**
     * Загрузить конфигурацию из файла
     */
    public static AuditorConfig load(Path path) {
        log.info("Загрузка конфигурации: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            return read(is);
        } catch (IOException e) {
            throw new IllegalStateException("Ошибка загрузки конфигурации " + path + ": " + e.getMessage(), e);
        }
    }

    static AuditorConfig read(InputStream is) throws IOException {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        AuditorConfig config = mapper.readValue(is, AuditorConfig.class);
        config.ensureDefaults();
        return config;
    }

    public void ensureDefaults() {
        if (cluster == null) {
            cluster = new Cluster();
        }
        cluster.ensureDefaults();
        if (rpc == null) {
            rpc = new Rpc();
        }
        rpc.ensureDefaults();
        if (orchestrator == null) {
            orchestrator = new Orchestrator();
        }
        orchestrator.ensureDefaults();
        if (simulator == null) {
            simulator = new Simulator();
        }
        simulator.ensureDefaults();
        if (reports == null) {
            reports = new Reports();
        }
        reports.ensureDefaults();
        if (knownAccounts == null) {
            knownAccounts = new LinkedHashMap<>();
        }
        if (parameters == null) {
            parameters = new LinkedHashMap<>();
        }
        if (targets == null) {
            targets = new ArrayList<>();
        }
        if (scenarios == null) {
            scenarios = new LinkedHashMap<>();
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Cluster {
        private String name;
        private String rpcUrl;
        private String commitment;

        public void ensureDefaults() {
            if (name == null || name.isBlank()) {
                name = "localnet";
            }
            if (commitment == null || commitment.isBlank()) {
                commitment = "confirmed";
            }
        }

        /**
         * Явный rpcUrl важнее имени кластера
         */
        public String resolveRpcUrl() {
            if (rpcUrl != null && !rpcUrl.isBlank()) {
                return rpcUrl.trim();
            }
            return switch (name.toLowerCase(Locale.ROOT)) {
                case "localnet", "localhost" -> "http://localhost:8899";
                case "devnet" -> "https://api.devnet.solana.com";
                case "testnet" -> "https://api.testnet.solana.com";
                case "mainnet", "mainnet-beta" -> "https://api.mainnet-beta.solana.com";
                default -> throw new IllegalStateException("Неизвестный кластер без rpcUrl: " + name);
            };
        }

        public boolean isMainnet() {
            String url = resolveRpcUrl();
            return name.toLowerCase(Locale.ROOT).startsWith("mainnet") || url.contains("mainnet");
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Rpc {
        private Integer connectTimeoutSec;
        private Integer callTimeoutSec;
        private Integer maxAttempts;
        private Long initialBackoffMs;
        private Long maxBackoffMs;
        private Integer confirmTimeoutSec;

        public void ensureDefaults() {
            if (connectTimeoutSec == null || connectTimeoutSec <= 0) {
                connectTimeoutSec = 5;
            }
            if (callTimeoutSec == null || callTimeoutSec <= 0) {
                callTimeoutSec = 20;
            }
            if (maxAttempts == null || maxAttempts <= 0) {
                maxAttempts = 3;
            }
            if (initialBackoffMs == null || initialBackoffMs < 0) {
                initialBackoffMs = 250L;
            }
            if (maxBackoffMs == null || maxBackoffMs < initialBackoffMs) {
                maxBackoffMs = Math.max(4000L, initialBackoffMs);
            }
            if (confirmTimeoutSec == null || confirmTimeoutSec <= 0) {
                confirmTimeoutSec = 30;
            }
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Orchestrator {
        private Long delayMs;
        private Integer scenarioTimeoutSec;
        /**
         * 0 - без ограничения
         */
        private Integer maxScenarios;
        private Integer drainTimeoutSec;

        public void ensureDefaults() {
            if (delayMs == null || delayMs < 0) {
                delayMs = 1000L;
            }
            if (scenarioTimeoutSec == null || scenarioTimeoutSec <= 0) {
                scenarioTimeoutSec = 60;
            }
            if (maxScenarios == null || maxScenarios < 0) {
                maxScenarios = 0;
            }
            if (drainTimeoutSec == null || drainTimeoutSec <= 0) {
                drainTimeoutSec = 30;
            }
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Simulator {
        /**
         * dry-run или committing
         */
        private String mode;
        /**
         * Keypair-файл Solana CLI с аккаунтом, оплачивающим комиссии симуляций.
         * Не должен совпадать с admin, атакующий остается отдельным одноразовым ключом.
         */
        private String feePayerKeypair;

        public void ensureDefaults() {
            if (mode == null || mode.isBlank()) {
                mode = "dry-run";
            }
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Reports {
        private String directory;
        private Integer keepLast;

        public void ensureDefaults() {
            if (directory == null || directory.isBlank()) {
                directory = "audit-reports";
            }
            if (keepLast == null || keepLast <= 0) {
                keepLast = 20;
            }
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Target {
        private String name;
        private String programId;
        private String advisory;
        /**
         * Ключ - имя возможности (swap, claim, privileged_operation, ...)
         */
        private Map<String, InstructionTemplate> instructions = new LinkedHashMap<>();
        private List<AccountTemplate> watchAccounts = new ArrayList<>();
        private List<AccountLayout> accountLayouts = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class InstructionTemplate {
        /**
         * Имя метода Anchor, из него считается дискриминатор
         */
        private String method;
        private String discriminatorHex;
        private List<AccountTemplate> accounts = new ArrayList<>();
        private List<ArgTemplate> args = new ArrayList<>();
    }

    /**
     * Ссылка на аккаунт: литеральный адрес, роль или PDA по seeds.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AccountTemplate {
        private String name;
        private String address;
        private String role;
        private List<String> seeds;
        /**
         * Роль программы, от которой выводится PDA. По умолчанию - сама цель.
         */
        private String seedProgram;
        private boolean signer;
        private boolean writable;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ArgTemplate {
        private String name;
        private String type;
        @JsonProperty("default")
        private String defaultValue;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AccountLayout {
        /**
         * Имя Anchor-аккаунта, дискриминатор = sha256("account:" + name)[0..8]
         */
        private String name;
        private String discriminatorHex;
        private List<FieldLayout> fields = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FieldLayout {
        private String name;
        private int offset;
        private String type;
        /**
         * Числовое поле попадает в balances снапшота
         */
        private boolean balance;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ScenarioOverride {
        private Boolean enabled;
        private List<String> programs;

        public boolean isEnabled() {
            return !Boolean.FALSE.equals(enabled);
        }
    }
}
