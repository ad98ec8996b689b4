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
 * Наследство: trigger и claim от имени постороннего ключа, пока владелец активен
 * и период неактивности не истек
 */
public class TimelockBypassScenario extends AttackScenario {

    public TimelockBypassScenario() {
        super("logic-inheritance-timelock-bypass",
            "Inheritance Timelock Bypass",
            "Triggers and claims an estate before its inactivity period and grace period have expired",
            AttackCategory.LOGIC, Severity.CRITICAL);
    }

    @Override
    public Set<Capability> requiredCapabilities() {
        return Set.of(Capability.TRIGGER, Capability.CLAIM);
    }

    @Override
    public CandidateTransaction build(TargetProgram target, ScenarioContext context) {
        return transaction(context)
            .instruction(invoke(target, context, Capability.TRIGGER, InstructionArgs.none()))
            .instruction(invoke(target, context, Capability.CLAIM, InstructionArgs.none()))
            .build();
    }
}
