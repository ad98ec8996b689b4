package com.vtb.auditor.core;

import com.vtb.auditor.chain.SignerIdentity;
import com.vtb.auditor.config.AuditorConfig;
import com.vtb.auditor.execution.SuiteSelection;
import com.vtb.auditor.integration.CICDIntegration;
import com.vtb.auditor.models.TestResult;
import com.vtb.auditor.models.TestStatus;
import com.vtb.auditor.models.TestSuiteReport;
import com.vtb.auditor.simulation.SimulationMode;
import com.vtb.auditor.testsupport.FakeChainClient;
import com.vtb.auditor.testsupport.TestFixtures;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AuditEngineTest {

    @Test
    void testEngineWiresCatalogScenariosAndRules() {
        AuditEngine engine = TestFixtures.engine(new FakeChainClient());

        assertEquals(2, engine.getCatalog().size());
        assertEquals(21, engine.getScenarios().size());
        assertEquals(8, engine.getRules().size());
        assertEquals(SimulationMode.DRY_RUN, engine.getMode(), "По умолчанию только симуляция");
    }

    @Test
    void testCommittingRefusedOnMainnet() {
        AuditorConfig config = TestFixtures.config();
        config.getCluster().setName("mainnet-beta");
        config.getSimulator().setMode("committing");

        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> new AuditEngine(config, new FakeChainClient(), TestFixtures.attacker(), TestFixtures.clock(), true));
        assertTrue(e.getMessage().contains("mainnet"));
    }

    @Test
    void testCommittingRequiresConfirmation() {
        AuditorConfig config = TestFixtures.config();
        config.getSimulator().setMode("committing");

        assertThrows(IllegalStateException.class,
            () -> new AuditEngine(config, new FakeChainClient(), TestFixtures.attacker(), TestFixtures.clock(), false));
    }

    @Test
    void testBadScenarioOverrideFailsBeforeAnyNetworkCall() {
        AuditorConfig config = TestFixtures.config();
        AuditorConfig.ScenarioOverride override = new AuditorConfig.ScenarioOverride();
        override.setEnabled(false);
        config.setScenarios(Map.of("no-such-scenario", override));
        FakeChainClient client = new FakeChainClient();

        assertThrows(RegistrationException.class, () -> TestFixtures.engine(config, client));
        assertEquals(0, client.simulationCount());
    }

    @Test
    void testUnfundedAttackerAsPayerLeavesEverythingUnevaluated() {
        FakeChainClient client = new FakeChainClient().respondWith((call, tx, post) ->
            FakeChainClient.anchorError("InvalidAmount", 6001, "Amount must be greater than zero"));
        AuditEngine engine = new AuditEngine(TestFixtures.config(), client, TestFixtures.attacker(),
            TestFixtures.clock(), false);

        TestSuiteReport report = engine.runSuite(SuiteSelection.builder().programs(Set.of("swap")).build());

        assertFalse(report.getResults().isEmpty());
        for (TestResult result : report.getResults()) {
            assertEquals(TestStatus.ERROR, result.getStatus(), result.getScenarioId());
        }
        TestResult zeroAmount = report.getResults().stream()
            .filter(result -> result.getScenarioId().equals("validation-zero-amount-swap"))
            .findFirst().orElseThrow();
        assertTrue(zeroAmount.getError().contains("AccountNotFound"), zeroAmount.getError());
        assertEquals(CICDIntegration.EXIT_NOT_EVALUATED, CICDIntegration.getExitCode(report, true));
    }

    @Test
    void testFundedFeePayerPaysAndAttackerStillSigns() {
        FakeChainClient client = new FakeChainClient().respondWith((call, tx, post) ->
            FakeChainClient.anchorError("InvalidAmount", 6001, "Amount must be greater than zero"));

        TestSuiteReport report = TestFixtures.engine(client).runSuite(SuiteSelection.builder()
            .scenarioIds(Set.of("validation-zero-amount-swap"))
            .build());

        assertEquals(TestStatus.PASSED, report.getResults().get(0).getStatus());
        byte[] transaction = client.simulatedTransactions().get(0);
        assertEquals(TestFixtures.feePayer().address(), FakeChainClient.feePayer(transaction));
        assertEquals(2, transaction[0], "Подписывают и fee payer, и атакующий");
        assertEquals(CICDIntegration.EXIT_OK, CICDIntegration.getExitCode(report, true));
    }

    @Test
    void testFeePayerMustNotBeAdmin() {
        AuditorConfig config = TestFixtures.config();
        SignerIdentity feePayer = TestFixtures.feePayer();
        config.getKnownAccounts().put(AuditEngine.ADMIN_ACCOUNT, feePayer.address());

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> new AuditEngine(config,
            new FakeChainClient(), TestFixtures.attacker(), feePayer, TestFixtures.clock(), false));
        assertTrue(e.getMessage().contains("admin"));
    }

    @Test
    void testFeePayerMustDifferFromAttacker() {
        assertThrows(IllegalStateException.class, () -> new AuditEngine(TestFixtures.config(),
            new FakeChainClient(), TestFixtures.attacker(), TestFixtures.attacker(), TestFixtures.clock(), false));
    }
}
