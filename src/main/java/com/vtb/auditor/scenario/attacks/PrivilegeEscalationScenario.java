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
 * Попытка назначить атакующего новым authority программы
 */
public class PrivilegeEscalationScenario extends AttackScenario {

    public PrivilegeEscalationScenario() {
        super("access-privilege-escalation",
            "Privilege Escalation",
            "Submits a privileged operation that names the attacker as the new authority",
            AttackCategory.ACCESS_CONTROL, Severity.CRITICAL);
    }

    @Override
    public Set<Capability> requiredCapabilities() {
        return Set.of(Capability.PRIVILEGED_OPERATION);
    }

    @Override
    public CandidateTransaction build(TargetProgram target, ScenarioContext context) {
        InstructionArgs args = InstructionArgs.builder()
            .value(ArgumentNames.NEW_AUTHORITY, context.getAttacker().address())
            .build();
        return transaction(context)
            .instruction(invoke(target, context, Capability.PRIVILEGED_OPERATION, args))
            .build();
    }
}
