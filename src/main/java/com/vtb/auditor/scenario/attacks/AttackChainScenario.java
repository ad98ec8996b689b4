package com.vtb.auditor.scenario.attacks;

import com.vtb.auditor.catalog.Capability;
import com.vtb.auditor.catalog.InstructionArgs;
import com.vtb.auditor.catalog.TargetProgram;
import com.vtb.auditor.chain.CandidateTransaction;
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
 * Цепочка claim/funding по всем программам каталога и swap в целевой в конце
 */
public class AttackChainScenario extends AttackScenario {

    public AttackChainScenario() {
        super("cross-program-attack-chain",
            "Cross-Program Attack Chain",
            "Chains claim, funding and swap calls across every capable program in one transaction",
            AttackCategory.CROSS_PROGRAM, Severity.CRITICAL);
    }

    @Override
    public Set<Capability> requiredCapabilities() {
        return Set.of(Capability.SWAP);
    }

    @Override
    public CandidateTransaction build(TargetProgram target, ScenarioContext context) {
        InstructionArgs args = InstructionArgs.builder()
            .value(ArgumentNames.AMOUNT, context.parameter("swap_amount", 1_000L))
            .build();
        CandidateTransaction.CandidateTransactionBuilder builder = transaction(context);
        Set<String> programs = new LinkedHashSet<>();
        for (TargetProgram partner : partners(target, context)) {
            if (partner.getCapabilities().supports(Capability.CLAIM)) {
                builder.instruction(invoke(partner, context, Capability.CLAIM, InstructionArgs.none()));
                programs.add(partner.getName());
            }
            if (partner.getCapabilities().supports(Capability.FUNDING)) {
                builder.instruction(invoke(partner, context, Capability.FUNDING, args));
                programs.add(partner.getName());
            }
        }
        if (programs.isEmpty()) {
            throw new InstructionBuildException("Нет программ для цепочки атаки с " + target.getName());
        }
        return builder
            .instruction(invoke(target, context, Capability.SWAP, args))
            .build();
    }

    @Override
    public List<String> watchedAccounts(TargetProgram target, ScenarioContext context) {
        Set<String> addresses = new LinkedHashSet<>(super.watchedAccounts(target, context));
        for (TargetProgram partner : partners(target, context)) {
            addWatchAccounts(addresses, partner, context);
        }
        return new ArrayList<>(addresses);
    }

    private static List<TargetProgram> partners(TargetProgram target, ScenarioContext context) {
        List<TargetProgram> partners = new ArrayList<>();
        for (TargetProgram candidate : context.getCatalog().all()) {
            if (candidate.getName().equals(target.getName())) {
                continue;
            }
            if (candidate.getCapabilities().supports(Capability.CLAIM)
                || candidate.getCapabilities().supports(Capability.FUNDING)) {
                partners.add(candidate);
            }
        }
        return partners;
    }
}
