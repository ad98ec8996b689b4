package com.vtb.auditor.scenario.attacks;

import com.vtb.auditor.catalog.Capability;
import com.vtb.auditor.catalog.InstructionArgs;
import com.vtb.auditor.catalog.TargetProgram;
import com.vtb.auditor.chain.CandidateTransaction;
import com.vtb.auditor.chain.Instruction;
import com.vtb.auditor.models.AttackCategory;
import com.vtb.auditor.models.Severity;
import com.vtb.auditor.scenario.AttackScenario;
import com.vtb.auditor.scenario.ScenarioContext;

import java.util.Set;

public class SwapReentrancyScenario extends AttackScenario {

    public SwapReentrancyScenario() {
        super("reentrancy-swap",
            "Swap Reentrancy Attempt",
            "Executes two swaps against the same pool state within one transaction",
            AttackCategory.REENTRANCY, Severity.HIGH);
    }

    @Override
    public Set<Capability> requiredCapabilities() {
        return Set.of(Capability.SWAP);
    }

    @Override
    public CandidateTransaction build(TargetProgram target, ScenarioContext context) {
        InstructionArgs args = InstructionArgs.builder()
            .value(ArgumentNames.AMOUNT, context.parameter("swap_amount", 1_000L))
            .build();
        Instruction swap = invoke(target, context, Capability.SWAP, args);
        return transaction(context)
            .instruction(swap)
            .instruction(swap)
            .build();
    }
}
