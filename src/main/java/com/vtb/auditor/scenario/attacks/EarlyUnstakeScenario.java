package com.vtb.auditor.scenario.attacks;

import com.vtb.auditor.catalog.Capability;
import com.vtb.auditor.catalog.InstructionArgs;
import com.vtb.auditor.catalog.TargetProgram;
import com.vtb.auditor.chain.CandidateTransaction;
import com.vtb.auditor.models.AttackCategory;
import com.vtb.auditor.models.Severity;
import com.vtb.auditor.scenario.AttackScenario;
import com.vtb.auditor.scenario.ScenarioContext;

import java.util.Set;

/**
 * Вывод сразу после пополнения, до окончания периода блокировки
 */
public class EarlyUnstakeScenario extends AttackScenario {

    public EarlyUnstakeScenario() {
        super("logic-early-unstake",
            "Early Unstake",
            "Withdraws immediately after funding, before any lock period can expire",
            AttackCategory.LOGIC, Severity.HIGH);
    }

    @Override
    public Set<Capability> requiredCapabilities() {
        return Set.of(Capability.FUNDING, Capability.WITHDRAW);
    }

    @Override
    public CandidateTransaction build(TargetProgram target, ScenarioContext context) {
        InstructionArgs args = InstructionArgs.builder()
            .value(ArgumentNames.AMOUNT, context.parameter("funding_amount", 1_000L))
            .build();
        return transaction(context)
            .instruction(invoke(target, context, Capability.FUNDING, args))
            .instruction(invoke(target, context, Capability.WITHDRAW, args))
            .build();
    }
}
