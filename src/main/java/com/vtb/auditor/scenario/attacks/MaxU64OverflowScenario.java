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

public class MaxU64OverflowScenario extends AttackScenario {

    static final BigInteger U64_MAX = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

    public MaxU64OverflowScenario() {
        super("overflow-max-u64",
            "Max u64 Funding Overflow",
            "Funds the program with u64::MAX to trigger unchecked arithmetic on deposit totals",
            AttackCategory.OVERFLOW, Severity.HIGH);
    }

    @Override
    public Set<Capability> requiredCapabilities() {
        return Set.of(Capability.FUNDING);
    }

    @Override
    public CandidateTransaction build(TargetProgram target, ScenarioContext context) {
        InstructionArgs args = InstructionArgs.builder().value(ArgumentNames.AMOUNT, U64_MAX).build();
        return transaction(context)
            .instruction(invoke(target, context, Capability.FUNDING, args))
            .build();
    }
}
