package com.vtb.auditor.scenario.attacks;

import com.vtb.auditor.catalog.Capability;
import com.vtb.auditor.catalog.InstructionArgs;
import com.vtb.auditor.catalog.TargetProgram;
import com.vtb.auditor.chain.CandidateTransaction;
import com.vtb.auditor.models.AttackCategory;
import com.vtb.auditor.models.Severity;
import com.vtb.auditor.scenario.AttackScenario;
import com.vtb.auditor.scenario.ScenarioContext;

import java.math.BigInteger;
import java.util.Set;

public class ZeroAmountSwapScenario extends AttackScenario {

    public ZeroAmountSwapScenario() {
        super("validation-zero-amount-swap",
            "Zero Amount Swap",
            "Submits a swap with amount = 0 to check input validation",
            AttackCategory.VALIDATION, Severity.MEDIUM);
    }

    @Override
    public Set<Capability> requiredCapabilities() {
        return Set.of(Capability.SWAP);
    }

    @Override
    public CandidateTransaction build(TargetProgram target, ScenarioContext context) {
        InstructionArgs args = InstructionArgs.builder().value(ArgumentNames.AMOUNT, BigInteger.ZERO).build();
        return transaction(context)
            .instruction(invoke(target, context, Capability.SWAP, args))
            .build();
    }
}
