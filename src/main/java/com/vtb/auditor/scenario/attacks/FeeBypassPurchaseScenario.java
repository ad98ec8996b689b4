package com.vtb.auditor.scenario.attacks;

import com.vtb.auditor.catalog.Capability;
import com.vtb.auditor.catalog.InstructionArgs;
import com.vtb.auditor.catalog.TargetProgram;
import com.vtb.auditor.chain.AccountMeta;
import com.vtb.auditor.chain.CandidateTransaction;
import com.vtb.auditor.chain.Instruction;
import com.vtb.auditor.chain.InstructionBuildException;
import com.vtb.auditor.models.AttackCategory;
import com.vtb.auditor.models.Severity;
import com.vtb.auditor.scenario.AttackScenario;
import com.vtb.auditor.scenario.ScenarioContext;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Покупка, в которой получатель комиссии платформы подменен токен-аккаунтом покупателя
 */
public class FeeBypassPurchaseScenario extends AttackScenario {

    public FeeBypassPurchaseScenario() {
        super("validation-fee-bypass-purchase",
            "Platform Fee Bypass",
            "Purchases access with the buyer's own token account passed as the platform fee recipient",
            AttackCategory.VALIDATION, Severity.HIGH);
    }

    @Override
    public Set<Capability> requiredCapabilities() {
        return Set.of(Capability.PURCHASE);
    }

    @Override
    public CandidateTransaction build(TargetProgram target, ScenarioContext context) {
        String feeAccount = context.textParameter("fee_account_name", "treasury");
        String attackerAccount = context.attackerTokenAccount();
        InstructionArgs args = InstructionArgs.builder()
            .accountOverride(feeAccount, attackerAccount)
            .build();
        Instruction purchase = invoke(target, context, Capability.PURCHASE, args);
        boolean substituted = purchase.getAccounts().stream()
            .map(AccountMeta::getAddress)
            .anyMatch(attackerAccount::equals);
        if (!substituted) {
            throw new InstructionBuildException("В шаблоне purchase программы " + target.getName()
                + " нет аккаунта " + feeAccount);
        }
        return transaction(context)
            .instruction(purchase)
            .build();
    }

    @Override
    public List<String> watchedAccounts(TargetProgram target, ScenarioContext context) {
        Set<String> addresses = new LinkedHashSet<>(super.watchedAccounts(target, context));
        addresses.add(context.attackerTokenAccount());
        return new ArrayList<>(addresses);
    }
}
