package com.vtb.auditor.detection;

import com.vtb.auditor.chain.AccountMeta;
import com.vtb.auditor.chain.CandidateTransaction;
import com.vtb.auditor.chain.Instruction;
import com.vtb.auditor.snapshot.AccountStateSnapshot;
import com.vtb.auditor.snapshot.StateSnapshot;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Каждое встроенное правило на сработавшем и чистом контексте
 */
class StandardRulesTest {

    private static final String ACCOUNT = "4Nd1mBQtrMJVYVfKf2PJy9NZUZdTAsp7D4xWLs4gDB4T";
    private static final Instant T0 = Instant.parse("2025-07-17T08:00:00Z");

    private final DetectionEngine engine = new DetectionEngine(DetectionRuleRegistry.standard());

    @Test
    void testStandardRegistryHasEightRules() {
        DetectionRuleRegistry registry = DetectionRuleRegistry.standard();

        assertEquals(8, registry.size());
        assertTrue(registry.find(StandardRules.REENTRANCY_PATTERN).isPresent());
        assertEquals(StandardRules.UNEXPECTED_BALANCE_CHANGE, registry.rules().get(0).getId(),
            "Порядок регистрации должен сохраняться");
    }

    @Test
    void testBaselineContextTriggersNothing() {
        assertTrue(engine.evaluate(DetectionContext.baseline()).isEmpty());
    }

    @Test
    void testBalanceChangeOverTenPercent() {
        DetectionContext context = withBalances(1_000, 850);

        assertTrue(StandardRules.unexpectedBalanceChange().evaluate(context));
    }

    @Test
    void testBalanceChangeWithinTenPercent() {
        assertFalse(StandardRules.unexpectedBalanceChange().evaluate(withBalances(1_000, 900)),
            "Ровно 10% не считается аномалией");
        assertFalse(StandardRules.unexpectedBalanceChange().evaluate(withBalances(1_000, 1_050)));
    }

    @Test
    void testBalanceFromZeroIsFlagged() {
        assertTrue(StandardRules.unexpectedBalanceChange().evaluate(withBalances(0, 1)));
    }

    @Test
    void testPrivilegeEscalationOnAuthorityChange() {
        DetectionContext context = withFields(Map.of("authority", "A"), Map.of("authority", "B"));

        assertTrue(StandardRules.privilegeEscalation().evaluate(context));
        assertFalse(StandardRules.privilegeEscalation()
            .evaluate(withFields(Map.of("admin", "A"), Map.of("admin", "A"))));
    }

    @Test
    void testPrivilegeEscalationIgnoresMissingPostField() {
        DetectionContext context = withFields(Map.of("owner", "A"), Map.of());

        assertFalse(StandardRules.privilegeEscalation().evaluate(context));
    }

    @Test
    void testReentrancyNeedsRepeatedInstructionLine() {
        DetectionContext repeated = withLogs(List.of(
            "Program log: Instruction: ClaimRewards",
            "Program log: Instruction: Transfer",
            "Program log: Instruction: ClaimRewards"));
        DetectionContext distinct = withLogs(List.of(
            "Program log: Instruction: ClaimRewards",
            "Program log: Instruction: Transfer"));

        assertTrue(StandardRules.reentrancyPattern().evaluate(repeated));
        assertFalse(StandardRules.reentrancyPattern().evaluate(distinct));
    }

    @Test
    void testOverflowMarkersInLogs() {
        assertTrue(StandardRules.overflowUnderflow()
            .evaluate(withLogs(List.of("Program log: panicked at 'attempt to add with overflow'"))));
        assertFalse(StandardRules.overflowUnderflow()
            .evaluate(withLogs(List.of("Program log: Instruction: Swap"))));
    }

    @Test
    void testDosByInstructionCountUnitsAndTime() {
        DetectionContext base = DetectionContext.baseline();

        assertTrue(StandardRules.dosPattern().evaluate(base.toBuilder().transaction(transaction(11)).build()));
        assertFalse(StandardRules.dosPattern().evaluate(base.toBuilder().transaction(transaction(10)).build()));
        assertTrue(StandardRules.dosPattern().evaluate(base.toBuilder().resourceUnitsConsumed(1_000_001L).build()));
        assertTrue(StandardRules.dosPattern().evaluate(base.toBuilder().executionTimeMs(30_001L).build()));
    }

    @Test
    void testDataManipulationOnMintFields() {
        assertTrue(StandardRules.dataManipulation()
            .evaluate(withFields(Map.of("totalSupply", "100"), Map.of("totalSupply", "1000"))));
        assertFalse(StandardRules.dataManipulation()
            .evaluate(withFields(Map.of("admin", "A"), Map.of("admin", "B"))));
    }

    @Test
    void testTimingWindow() {
        DetectionContext base = DetectionContext.baseline();
        DetectionContext late = base.toBuilder()
            .preState(StateSnapshot.empty("pre", T0))
            .postState(StateSnapshot.empty("post", T0.plusSeconds(3_601)))
            .build();
        DetectionContext backwards = base.toBuilder()
            .preState(StateSnapshot.empty("pre", T0))
            .postState(StateSnapshot.empty("post", T0.minusSeconds(1)))
            .build();
        DetectionContext normal = base.toBuilder()
            .preState(StateSnapshot.empty("pre", T0))
            .postState(StateSnapshot.empty("post", T0.plusSeconds(2)))
            .build();

        assertTrue(StandardRules.timingAttack().evaluate(late));
        assertTrue(StandardRules.timingAttack().evaluate(backwards));
        assertFalse(StandardRules.timingAttack().evaluate(normal));
    }

    @Test
    void testCrossProgramNeedsManyProgramsAndInvokes() {
        List<Instruction> instructions = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            instructions.add(new Instruction(program(i), List.of(), new byte[0]));
        }
        CandidateTransaction transaction = CandidateTransaction.builder()
            .label("chain")
            .instructions(instructions)
            .build();
        List<String> logs = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            logs.add("Program " + program(i % 4) + " invoke [1]");
        }
        DetectionContext context = DetectionContext.baseline().toBuilder()
            .transaction(transaction)
            .logs(logs)
            .build();

        assertTrue(StandardRules.crossProgramExploit().evaluate(context));
        assertFalse(StandardRules.crossProgramExploit()
            .evaluate(context.toBuilder().logs(logs.subList(0, 5)).build()));
    }

    @Test
    void testEngineReturnsEveryMatch() {
        DetectionContext context = withBalances(1_000, 10).toBuilder()
            .logs(List.of("Program log: Instruction: Swap", "Program log: Instruction: Swap"))
            .build();

        List<RuleMatch> matches = engine.evaluate(context);

        assertEquals(2, matches.size());
        assertEquals(StandardRules.UNEXPECTED_BALANCE_CHANGE, matches.get(0).rule().getId());
        assertEquals(StandardRules.REENTRANCY_PATTERN, matches.get(1).rule().getId());
    }

    private static DetectionContext withBalances(long before, long after) {
        return DetectionContext.baseline().toBuilder()
            .preState(snapshot("pre", account(Map.of("SOL", BigInteger.valueOf(before)), Map.of())))
            .postState(snapshot("post", account(Map.of("SOL", BigInteger.valueOf(after)), Map.of())))
            .build();
    }

    private static DetectionContext withFields(Map<String, String> before, Map<String, String> after) {
        return DetectionContext.baseline().toBuilder()
            .preState(snapshot("pre", account(Map.of(), before)))
            .postState(snapshot("post", account(Map.of(), after)))
            .build();
    }

    private static DetectionContext withLogs(List<String> logs) {
        return DetectionContext.baseline().toBuilder().logs(logs).build();
    }

    private static StateSnapshot snapshot(String id, AccountStateSnapshot account) {
        return StateSnapshot.builder()
            .id(id)
            .capturedAt(T0)
            .accounts(Map.of(account.getAddress(), account))
            .build();
    }

    private static AccountStateSnapshot account(Map<String, BigInteger> balances, Map<String, String> fields) {
        return AccountStateSnapshot.builder()
            .address(ACCOUNT)
            .exists(true)
            .balances(balances)
            .decodedFields(fields)
            .capturedAt(T0)
            .build();
    }

    private static CandidateTransaction transaction(int instructions) {
        CandidateTransaction.CandidateTransactionBuilder builder = CandidateTransaction.builder().label("dos");
        for (int i = 0; i < instructions; i++) {
            builder.instruction(new Instruction(program(0),
                List.of(AccountMeta.writable(ACCOUNT, false)), new byte[]{(byte) i}));
        }
        return builder.build();
    }

    private static String program(int index) {
        return List.of(
            "5ag9ncKTGrhDxdfvRxmSenP848kkgP6BMdaTFLfa2siT",
            "DtTDbmQgghWJYp3F4vhaaJGyGoF86qRZh9t2kMtmPBbg",
            "DYXXvied9wwpDaE1NcVS56BfeQ4ZxXozft7FCLNVUG41",
            "7NF6yiQeRbNpYZJzgdijQErD1WYh9mUxwN5SBDpSA6dX").get(index);
    }
}
