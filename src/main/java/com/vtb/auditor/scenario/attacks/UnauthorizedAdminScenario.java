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
 * Привилегированная операция, подписанная свежим ключом без прав администратора
 */
public class UnauthorizedAdminScenario extends AttackScenario {

    public UnauthorizedAdminScenario() {
        super("access-unauthorized-admin",
            "Unauthorized Admin Operation",
            "Invokes a privileged operation signed by a freshly generated non-admin keypair",
            AttackCategory.ACCESS_CONTROL, Severity.CRITICAL);
    }

    @Override
    public Set<Capability> requiredCapabilities() {
        return Set.of(Capability.PRIVILEGED_OPERATION);
    }

    @Override
    public CandidateTransaction build(TargetProgram target, ScenarioContext context) {
        return transaction(context)
            .instruction(invoke(target, context, Capability.PRIVILEGED_OPERATION, InstructionArgs.none()))
            .build();
    }
}
