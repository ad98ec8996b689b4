package com.vtb.auditor.scenario.attacks;

import com.vtb.auditor.scenario.AttackScenario;
import com.vtb.auditor.scenario.ScenarioLibrary;

import java.util.List;

/**
 * Встроенный набор сценариев атак
 */
public final class StandardScenarios {

    private StandardScenarios() {
    }

    public static List<AttackScenario> all() {
        return List.of(
            new UnauthorizedAdminScenario(),
            new PrivilegeEscalationScenario(),
            new MaxU64OverflowScenario(),
            new AmountUnderflowScenario(),
            new ZeroAmountSwapScenario(),
            new AccountSubstitutionScenario(),
            new SlippageExploitScenario(),
            new FeeBypassPurchaseScenario(),
            new ClaimReentrancyScenario(),
            new SwapReentrancyScenario(),
            new DoubleFundingSpendScenario(),
            new ResourceExhaustionScenario(),
            new ComputeExhaustionScenario(),
            new TimestampManipulationScenario(),
            new StalePriceScenario(),
            new SandwichAttackScenario(),
            new FlashLoanManipulationScenario(),
            new EarlyUnstakeScenario(),
            new TimelockBypassScenario(),
            new SwapStakeChainScenario(),
            new AttackChainScenario()
        );
    }

    public static ScenarioLibrary registerAll(ScenarioLibrary library) {
        all().forEach(library::register);
        return library;
    }
}
