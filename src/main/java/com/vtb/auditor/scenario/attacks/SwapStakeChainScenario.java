package com.vtb.auditor.scenario.attacks;

import com.vtb.auditor.catalog.Capability;
import com.vtb.auditor.catalog.InstructionArgs;
import com.vtb.auditor.catalog.TargetProgram;
import com.vtb.auditor.chain.CandidateTransaction;
import com.vtb.auditor.chain.InstructionBuildException;
import com.vtb.auditor.models.AttackCategory;
import com.vtb.auditor.models.Severity;
import com.vtb.auditor.scenario.AttackScenario;
import com.vtb.auditor.scenario.ScenarioContext;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Swap в целевой программе и сразу вложение результата в другую программу каталога
 */
public class SwapStakeChainScenario extends AttackScenario {

    public SwapStakeChainScenario() {
        super("cross-program-swap-stake",
            "Swap and Stake Chain",
            "Swaps on the target and stakes the proceeds in another program within one transaction",
            AttackCategory.CROSS_PROGRAM, Severity.CRITICAL);
    }

    @Override
    public Set<Capability> requiredCapabilities() {
        return Set.of(Capability.SWAP);
    }

    @Override
    public CandidateTransaction build(TargetProgram target, ScenarioContext context) {
        TargetProgram stakingTarget = findFundingPartner(target, context);
        InstructionArgs args = InstructionArgs.builder()
            .value(ArgumentNames.AMOUNT, context.parameter("swap_amount", 1_000L))
            .build();
        return transaction(context)
            .instruction(invoke(target, context, Capability.SWAP, args))
            .instruction(invoke(stakingTarget, context, Capability.FUNDING, args))
            .build();
    }

    @Override
    public List<String> watchedAccounts(TargetProgram target, ScenarioContext context) {
        Set<String> addresses = new LinkedHashSet<>(super.watchedAccounts(target, context));
        addWatchAccounts(addresses, findFundingPartner(target, context), context);
        return new ArrayList<>(addresses);
    }

    private static TargetProgram findFundingPartner(TargetProgram target, ScenarioContext context) {
        return context.getCatalog().all().stream()
            .filter(candidate -> !candidate.getName().equals(target.getName()))
            .filter(candidate -> candidate.getCapabilities().supports(Capability.FUNDING))
            .findFirst()
            .orElseThrow(() -> new InstructionBuildException(
                "В каталоге нет второй программы с операцией funding для " + target.getName()));
    }
}
