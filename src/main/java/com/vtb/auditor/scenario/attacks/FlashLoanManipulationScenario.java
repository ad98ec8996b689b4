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
 * Заемная ликвидность двигает цену, сделка по сдвинутой цене, обратный swap.
 * Займ не моделируется: атакующий просто заявляет сумму займа.
 */
public class FlashLoanManipulationScenario extends AttackScenario {

    public FlashLoanManipulationScenario() {
        super("oracle-flash-loan-manipulation",
            "Flash Loan Price Manipulation",
            "Moves the pool price with a borrowed-size swap, trades at the skewed price and swaps back",
            AttackCategory.ORACLE, Severity.HIGH);
    }

    @Override
    public Set<Capability> requiredCapabilities() {
        return Set.of(Capability.SWAP);
    }

    @Override
    public CandidateTransaction build(TargetProgram target, ScenarioContext context) {
        InstructionArgs borrowed = InstructionArgs.builder()
            .value(ArgumentNames.AMOUNT, context.parameter("flash_loan_amount", 1_000_000_000_000_000L))
            .build();
        InstructionArgs exploit = InstructionArgs.builder()
            .value(ArgumentNames.AMOUNT, context.parameter("flash_loan_exploit_amount", 100_000_000_000L))
            .build();
        return transaction(context)
            .instruction(invoke(target, context, Capability.SWAP, borrowed))
            .instruction(invoke(target, context, Capability.SWAP, exploit))
            .instruction(invoke(target, context, Capability.SWAP, borrowed))
            .build();
    }
}
