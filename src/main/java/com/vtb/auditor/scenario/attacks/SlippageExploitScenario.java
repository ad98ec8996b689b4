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

/**
 * Крупный swap без защиты от проскальзывания: минимальный выход равен нулю.
 * Если шаблон не объявляет minimum_amount_out, проверяется сама программа без этого параметра.
 */
public class SlippageExploitScenario extends AttackScenario {

    public SlippageExploitScenario() {
        super("validation-slippage-exploit",
            "Slippage Exploit",
            "Swaps a pool-moving amount while accepting any output (zero minimum amount out)",
            AttackCategory.VALIDATION, Severity.HIGH);
    }

    @Override
    public Set<Capability> requiredCapabilities() {
        return Set.of(Capability.SWAP);
    }

    @Override
    public CandidateTransaction build(TargetProgram target, ScenarioContext context) {
        InstructionArgs args = InstructionArgs.builder()
            .value(ArgumentNames.AMOUNT, context.parameter("slippage_amount", 100_000_000_000L))
            .value(ArgumentNames.MINIMUM_AMOUNT_OUT, BigInteger.ZERO)
            .build();
        return transaction(context)
            .instruction(invoke(target, context, Capability.SWAP, args))
            .build();
    }
}
