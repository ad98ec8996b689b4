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
 * Front-run, сделка жертвы, back-run. Все три swap в одной транзакции,
 * чтобы симуляция видела их над одним состоянием пула.
 */
public class SandwichAttackScenario extends AttackScenario {

    public SandwichAttackScenario() {
        super("oracle-sandwich-attack",
            "Sandwich Attack",
            "Brackets a regular-sized swap between two large attacker swaps in one transaction",
            AttackCategory.ORACLE, Severity.HIGH);
    }

    @Override
    public Set<Capability> requiredCapabilities() {
        return Set.of(Capability.SWAP);
    }

    @Override
    public CandidateTransaction build(TargetProgram target, ScenarioContext context) {
        InstructionArgs bracket = InstructionArgs.builder()
            .value(ArgumentNames.AMOUNT, context.parameter("sandwich_amount", 500_000_000_000L))
            .build();
        InstructionArgs victim = InstructionArgs.builder()
            .value(ArgumentNames.AMOUNT, context.parameter("swap_amount", 1_000L))
            .build();
        return transaction(context)
            .instruction(invoke(target, context, Capability.SWAP, bracket))
            .instruction(invoke(target, context, Capability.SWAP, victim))
            .instruction(invoke(target, context, Capability.SWAP, bracket))
            .build();
    }
}
