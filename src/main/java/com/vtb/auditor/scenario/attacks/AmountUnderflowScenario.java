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
 * Вывод суммы больше баланса атакующего. Баланс берется из параметра attacker_balance.
 */
public class AmountUnderflowScenario extends AttackScenario {

    public AmountUnderflowScenario() {
        super("overflow-amount-underflow",
            "Withdrawal Underflow",
            "Withdraws more than the attacker's recorded balance to trigger unchecked subtraction",
            AttackCategory.OVERFLOW, Severity.HIGH);
    }

    @Override
    public Set<Capability> requiredCapabilities() {
        return Set.of(Capability.WITHDRAW);
    }

    @Override
    public CandidateTransaction build(TargetProgram target, ScenarioContext context) {
        BigInteger balance = context.parameter("attacker_balance", 0);
        BigInteger excess = context.parameter("underflow_excess", 1_000_000L);
        InstructionArgs args = InstructionArgs.builder()
            .value(ArgumentNames.AMOUNT, balance.add(excess.max(BigInteger.ONE)))
            .build();
        return transaction(context)
            .instruction(invoke(target, context, Capability.WITHDRAW, args))
            .build();
    }
}
