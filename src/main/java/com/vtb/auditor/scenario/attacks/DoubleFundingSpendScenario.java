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
 * Два пополнения из одного источника в одной транзакции
 */
public class DoubleFundingSpendScenario extends AttackScenario {

    public DoubleFundingSpendScenario() {
        super("double-spend-funding",
            "Double Funding Spend",
            "Consumes the same funding source twice within one transaction",
            AttackCategory.DOUBLE_SPEND, Severity.CRITICAL);
    }

    @Override
    public Set<Capability> requiredCapabilities() {
        return Set.of(Capability.FUNDING);
    }

    @Override
    public CandidateTransaction build(TargetProgram target, ScenarioContext context) {
        InstructionArgs args = InstructionArgs.builder()
            .value(ArgumentNames.AMOUNT, context.parameter("funding_amount", 1_000L))
            .build();
        Instruction funding = invoke(target, context, Capability.FUNDING, args);
        return transaction(context)
            .instruction(funding)
            .instruction(funding)
            .build();
    }
}
