package com.vtb.auditor.scenario;

import com.vtb.auditor.catalog.TargetCatalog;
import com.vtb.auditor.catalog.TargetCatalogLoader;
import com.vtb.auditor.catalog.TargetProgram;
import com.vtb.auditor.chain.CandidateTransaction;
import com.vtb.auditor.config.AuditorConfig;
import com.vtb.auditor.core.RegistrationException;
import com.vtb.auditor.models.AttackCategory;
import com.vtb.auditor.models.Severity;
import com.vtb.auditor.scenario.attacks.StandardScenarios;
import com.vtb.auditor.testsupport.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ScenarioLibraryTest {

    private TargetCatalog catalog;
    private ScenarioLibrary library;

    @BeforeEach
    void setUp() {
        catalog = TargetCatalogLoader.load(TestFixtures.config());
        library = StandardScenarios.registerAll(new ScenarioLibrary(catalog));
    }

    @Test
    void testStandardScenariosRegistered() {
        assertEquals(21, library.size());
        assertTrue(library.find("reentrancy-claim").isPresent());
        assertFalse(library.find("missing").isPresent());
    }

    @Test
    void testDuplicateScenarioRejected() {
        assertThrows(RegistrationException.class,
            () -> library.register(new StubScenario("reentrancy-claim", AttackCategory.REENTRANCY, Set.of("*"))));
    }

    @Test
    void testInfrastructureCategoryNotAllowedForAttacks() {
        assertThrows(RegistrationException.class,
            () -> library.register(new StubScenario("stub", AttackCategory.INFRASTRUCTURE, Set.of("*"))));
    }

    @Test
    void testUnknownProgramRejected() {
        RegistrationException e = assertThrows(RegistrationException.class,
            () -> library.register(new StubScenario("stub", AttackCategory.LOGIC, Set.of("lending"))));
        assertTrue(e.getMessage().contains("lending"));
    }

    @Test
    void testEmptyProgramSetRejected() {
        assertThrows(RegistrationException.class,
            () -> library.register(new StubScenario("stub", AttackCategory.LOGIC, Set.of())));
    }

    @Test
    void testPlanSkipsProgramsWithoutCapabilities() {
        List<String> pairs = describe(library.plan(Set.of(), Set.of(), Set.of()));

        assertEquals(17, pairs.size(), pairs.toString());
        assertTrue(pairs.contains("reentrancy-claim -> staking"));
        assertFalse(pairs.contains("reentrancy-claim -> swap"), "У swap нет операции claim");
        assertFalse(pairs.stream().anyMatch(pair -> pair.startsWith("oracle-stale-price")), "В каталоге нет price_update");
        assertTrue(pairs.contains("oracle-sandwich-attack -> swap"));
        assertTrue(pairs.contains("oracle-flash-loan-manipulation -> swap"));
        assertTrue(pairs.contains("validation-slippage-exploit -> swap"));
        assertFalse(pairs.stream().anyMatch(pair -> pair.startsWith("logic-inheritance-timelock-bypass")),
            "В каталоге нет trigger");
        assertFalse(pairs.stream().anyMatch(pair -> pair.startsWith("validation-fee-bypass-purchase")),
            "В каталоге нет purchase");
        assertEquals("access-unauthorized-admin -> swap", pairs.get(0));
    }

    @Test
    void testPlanFilters() {
        List<String> dos = describe(library.plan(Set.of(AttackCategory.DOS), Set.of(), Set.of()));
        assertEquals(List.of(
            "dos-resource-exhaustion -> swap",
            "dos-resource-exhaustion -> staking",
            "dos-compute-exhaustion -> swap",
            "dos-compute-exhaustion -> staking"), dos);

        List<String> staking = describe(library.plan(Set.of(AttackCategory.DOS), Set.of("staking"), Set.of()));
        assertEquals(2, staking.size());

        List<String> single = describe(library.plan(Set.of(), Set.of(), Set.of("validation-zero-amount-swap")));
        assertEquals(List.of("validation-zero-amount-swap -> swap"), single);
    }

    @Test
    void testCustomScenarioRestrictedToProgram() {
        library.register(new StubScenario("logic-stub", AttackCategory.LOGIC, Set.of("staking")));

        List<String> pairs = describe(library.plan(Set.of(AttackCategory.LOGIC), Set.of(), Set.of()));

        assertEquals(List.of("logic-stub -> staking"), pairs);
    }

    @Test
    void testOverridesDisableAndNarrow() {
        AuditorConfig.ScenarioOverride disabled = new AuditorConfig.ScenarioOverride();
        disabled.setEnabled(false);
        AuditorConfig.ScenarioOverride narrowed = new AuditorConfig.ScenarioOverride();
        narrowed.setPrograms(List.of("staking"));

        library.applyOverrides(Map.of("reentrancy-swap", disabled, "dos-resource-exhaustion", narrowed));

        List<String> pairs = describe(library.plan(Set.of(), Set.of(), Set.of()));
        assertFalse(pairs.contains("reentrancy-swap -> swap"));
        assertFalse(pairs.contains("dos-resource-exhaustion -> swap"));
        assertTrue(pairs.contains("dos-resource-exhaustion -> staking"));
    }

    @Test
    void testOverrideForUnknownScenarioRejected() {
        assertThrows(RegistrationException.class,
            () -> library.applyOverrides(Map.of("nope", new AuditorConfig.ScenarioOverride())));
    }

    private static List<String> describe(List<ScenarioPair> pairs) {
        return pairs.stream().map(ScenarioPair::describe).collect(Collectors.toList());
    }

    private static class StubScenario extends AttackScenario {

        private final Set<String> programs;

        StubScenario(String id, AttackCategory category, Set<String> programs) {
            super(id, "Stub", "Test stub", category, Severity.LOW);
            this.programs = programs;
        }

        @Override
        public Set<String> applicablePrograms() {
            return programs;
        }

        @Override
        public CandidateTransaction build(TargetProgram target, ScenarioContext context) {
            return transaction(context).build();
        }
    }
}
