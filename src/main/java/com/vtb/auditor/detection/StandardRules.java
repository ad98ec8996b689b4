package com.vtb.auditor.detection;

import com.vtb.auditor.models.Severity;
import com.vtb.auditor.snapshot.AccountStateSnapshot;
import com.vtb.auditor.snapshot.StateSnapshot;

import java.math.BigInteger;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Встроенный набор правил детектора
 */
public final class StandardRules {

    public static final String UNEXPECTED_BALANCE_CHANGE = "unexpected_balance_change";
    public static final String PRIVILEGE_ESCALATION = "privilege_escalation";
    public static final String REENTRANCY_PATTERN = "reentrancy_pattern";
    public static final String OVERFLOW_UNDERFLOW = "overflow_underflow";
    public static final String DOS_PATTERN = "dos_pattern";
    public static final String DATA_MANIPULATION = "data_manipulation";
    public static final String TIMING_ATTACK = "timing_attack";
    public static final String CROSS_PROGRAM_EXPLOIT = "cross_program_exploit";

    static final long DOS_UNITS_THRESHOLD = 1_000_000L;
    static final int DOS_INSTRUCTION_THRESHOLD = 10;
    static final long DOS_TIME_THRESHOLD_MS = 30_000L;
    static final Duration TIMING_WINDOW = Duration.ofHours(1);
    static final int CROSS_PROGRAM_MIN_PROGRAMS = 3;
    static final int CROSS_PROGRAM_MIN_CPI_LOGS = 5;

    private static final String INSTRUCTION_LOG_PREFIX = "Program log: Instruction:";
    private static final List<String> AUTHORITY_FIELDS = List.of("admin", "owner", "authority");
    private static final List<String> CRITICAL_MINT_FIELDS =
        List.of("totalSupply", "decimals", "mintAuthority", "freezeAuthority");
    private static final List<String> ARITHMETIC_MARKERS = List.of(
        "overflow", "underflow", "attempt to subtract with overflow", "attempt to add with overflow");

    private StandardRules() {
    }

    public static List<DetectionRule> all() {
        return List.of(
            unexpectedBalanceChange(),
            privilegeEscalation(),
            reentrancyPattern(),
            overflowUnderflow(),
            dosPattern(),
            dataManipulation(),
            timingAttack(),
            crossProgramExploit()
        );
    }

    public static DetectionRuleRegistry registerAll(DetectionRuleRegistry registry) {
        all().forEach(registry::register);
        return registry;
    }

    static DetectionRule unexpectedBalanceChange() {
        return DetectionRule.builder()
            .id(UNEXPECTED_BALANCE_CHANGE)
            .name("Unexpected Balance Change")
            .description("Detects unauthorized token transfers or balance modifications")
            .category(RuleCategory.THEFT)
            .severity(Severity.CRITICAL)
            .predicate(StandardRules::hasUnexpectedBalanceChange)
            .build();
    }

    static DetectionRule privilegeEscalation() {
        return DetectionRule.builder()
            .id(PRIVILEGE_ESCALATION)
            .name("Privilege Escalation")
            .description("Detects unauthorized admin or owner changes")
            .category(RuleCategory.ACCESS_CONTROL)
            .severity(Severity.CRITICAL)
            .predicate(context -> anyFieldChanged(context, AUTHORITY_FIELDS))
            .build();
    }

    static DetectionRule reentrancyPattern() {
        return DetectionRule.builder()
            .id(REENTRANCY_PATTERN)
            .name("Reentrancy Pattern")
            .description("Detects potential reentrancy attacks")
            .category(RuleCategory.REENTRANCY)
            .severity(Severity.HIGH)
            .predicate(StandardRules::hasRepeatedInstruction)
            .build();
    }

    static DetectionRule overflowUnderflow() {
        return DetectionRule.builder()
            .id(OVERFLOW_UNDERFLOW)
            .name("Integer Overflow/Underflow")
            .description("Detects arithmetic errors")
            .category(RuleCategory.ARITHMETIC)
            .severity(Severity.HIGH)
            .predicate(context -> context.getLogs().stream()
                .anyMatch(line -> ARITHMETIC_MARKERS.stream().anyMatch(line::contains)))
            .build();
    }

    static DetectionRule dosPattern() {
        return DetectionRule.builder()
            .id(DOS_PATTERN)
            .name("DOS Attack Pattern")
            .description("Detects denial of service attempts")
            .category(RuleCategory.DOS)
            .severity(Severity.MEDIUM)
            .predicate(context -> context.getResourceUnitsConsumed() > DOS_UNITS_THRESHOLD
                || context.instructionCount() > DOS_INSTRUCTION_THRESHOLD
                || context.getExecutionTimeMs() > DOS_TIME_THRESHOLD_MS)
            .build();
    }

    static DetectionRule dataManipulation() {
        return DetectionRule.builder()
            .id(DATA_MANIPULATION)
            .name("Data Manipulation")
            .description("Detects unauthorized data modifications")
            .category(RuleCategory.INTEGRITY)
            .severity(Severity.HIGH)
            .predicate(context -> anyFieldChanged(context, CRITICAL_MINT_FIELDS))
            .build();
    }

    static DetectionRule timingAttack() {
        return DetectionRule.builder()
            .id(TIMING_ATTACK)
            .name("Timing Attack")
            .description("Detects time-based vulnerabilities")
            .category(RuleCategory.TIMING)
            .severity(Severity.MEDIUM)
            .predicate(StandardRules::hasTimingAnomaly)
            .build();
    }

    static DetectionRule crossProgramExploit() {
        return DetectionRule.builder()
            .id(CROSS_PROGRAM_EXPLOIT)
            .name("Cross-Program Exploit")
            .description("Detects vulnerabilities from program interactions")
            .category(RuleCategory.CROSS_PROGRAM)
            .severity(Severity.CRITICAL)
            .predicate(StandardRules::hasCrossProgramPattern)
            .build();
    }

    private static boolean hasUnexpectedBalanceChange(DetectionContext context) {
        for (AccountStateSnapshot pre : context.getPreState().getAccounts().values()) {
            AccountStateSnapshot post = context.getPostState().account(pre.getAddress());
            if (post == null) {
                continue;
            }
            for (Map.Entry<String, BigInteger> balance : pre.getBalances().entrySet()) {
                BigInteger before = balance.getValue();
                BigInteger after = post.getBalances().getOrDefault(balance.getKey(), BigInteger.ZERO);
                // |after - before| > 0.1 * before
                if (after.subtract(before).abs().multiply(BigInteger.TEN).compareTo(before) > 0) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean anyFieldChanged(DetectionContext context, List<String> fields) {
        StateSnapshot post = context.getPostState();
        for (AccountStateSnapshot pre : context.getPreState().getAccounts().values()) {
            AccountStateSnapshot after = post.account(pre.getAddress());
            if (after == null) {
                continue;
            }
            for (String field : fields) {
                String before = pre.getDecodedFields().get(field);
                String now = after.getDecodedFields().get(field);
                if (before != null && now != null && !Objects.equals(before, now)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean hasRepeatedInstruction(DetectionContext context) {
        Map<String, Integer> counts = new HashMap<>();
        for (String line : context.getLogs()) {
            if (!line.contains(INSTRUCTION_LOG_PREFIX)) {
                continue;
            }
            if (counts.merge(line.trim(), 1, Integer::sum) >= 2) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasTimingAnomaly(DetectionContext context) {
        if (context.getPreState().getCapturedAt() == null || context.getPostState().getCapturedAt() == null) {
            return false;
        }
        Duration elapsed = Duration.between(context.getPreState().getCapturedAt(),
            context.getPostState().getCapturedAt());
        return elapsed.isNegative() || elapsed.compareTo(TIMING_WINDOW) > 0;
    }

    private static boolean hasCrossProgramPattern(DetectionContext context) {
        int programs = context.getTransaction() != null ? context.getTransaction().programIds().size() : 0;
        long cpiLogs = context.getLogs().stream()
            .filter(line -> line.contains("Program log: CPI:") || line.contains("invoke"))
            .count();
        return programs > CROSS_PROGRAM_MIN_PROGRAMS && cpiLogs > CROSS_PROGRAM_MIN_CPI_LOGS;
    }
}
