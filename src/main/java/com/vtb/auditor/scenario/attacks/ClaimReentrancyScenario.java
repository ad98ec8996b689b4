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

/**
 * Две одинаковые claim-инструкции в одной транзакции
 */
public class ClaimReentrancyScenario extends AttackScenario {

    public ClaimReentrancyScenario() {
        super("reentrancy-claim",
            "Claim Reentrancy Attempt",
            "Submits the same claim instruction twice within one atomic transaction",
            AttackCategory.REENTRANCY, Severity.HIGH);
    }

    @Override
    public Set<Capability> requiredCapabilities() {
        return Set.of(Capability.CLAIM);
    }

    @Override
    public CandidateTransaction build(TargetProgram target, ScenarioContext context) {
        Instruction claim = invoke(target, context, Capability.CLAIM, InstructionArgs.none());
        return transaction(context)
            .instruction(claim)
            .instruction(claim)
            .build();
    }
}
