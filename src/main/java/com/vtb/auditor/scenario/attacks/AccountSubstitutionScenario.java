package com.vtb.auditor.scenario.attacks;

import com.vtb.auditor.catalog.Capability;
import com.vtb.auditor.catalog.InstructionArgs;
import com.vtb.auditor.catalog.TargetProgram;
import com.vtb.auditor.chain.CandidateTransaction;
import com.vtb.auditor.models.AttackCategory;
import com.vtb.auditor.models.Severity;
import com.vtb.auditor.scenario.AttackScenario;
import com.vtb.auditor.scenario.ScenarioContext;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Swap, в котором аккаунт хранилища подменен токен-аккаунтом атакующего
 */
public class AccountSubstitutionScenario extends AttackScenario {

    public AccountSubstitutionScenario() {
        super("validation-account-substitution",
            "Vault Account Substitution",
            "Swaps with an attacker-owned token account passed in place of the program vault",
            AttackCategory.VALIDATION, Severity.HIGH);
    }

    @Override
    public Set<Capability> requiredCapabilities() {
        return Set.of(Capability.SWAP);
    }

    @Override
    public CandidateTransaction build(TargetProgram target, ScenarioContext context) {
        String vaultName = context.textParameter("vault_account_name", "vault");
        InstructionArgs args = InstructionArgs.builder()
            .value(ArgumentNames.AMOUNT, context.parameter("swap_amount", 1_000L))
            .accountOverride(vaultName, context.attackerTokenAccount())
            .build();
        return transaction(context)
            .instruction(invoke(target, context, Capability.SWAP, args))
            .build();
    }

    @Override
    public List<String> watchedAccounts(TargetProgram target, ScenarioContext context) {
        Set<String> addresses = new LinkedHashSet<>(super.watchedAccounts(target, context));
        addresses.add(context.attackerTokenAccount());
        return new ArrayList<>(addresses);
    }
}
