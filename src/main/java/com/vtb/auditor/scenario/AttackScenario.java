package com.vtb.auditor.scenario;

import com.vtb.auditor.catalog.BuildContext;
import com.vtb.auditor.catalog.Capability;
import com.vtb.auditor.catalog.InstructionArgs;
import com.vtb.auditor.catalog.TargetProgram;
import com.vtb.auditor.chain.CandidateTransaction;
import com.vtb.auditor.chain.Instruction;
import com.vtb.auditor.chain.SignerIdentity;
import com.vtb.auditor.config.AuditorConfig;
import com.vtb.auditor.models.AttackCategory;
import com.vtb.auditor.models.Severity;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Базовый класс сценария атаки. Сценарий только собирает транзакцию-кандидат
 * и не предполагает, что атака удастся.
 */
public abstract class AttackScenario {

    /**
     * Маркер "применим ко всем программам"
     */
    public static final Set<String> ALL_PROGRAMS = Set.of("*");

    private final String id;
    private final String name;
    private final String description;
    private final AttackCategory category;
    private final Severity severity;

    protected AttackScenario(String id, String name, String description,
                             AttackCategory category, Severity severity) {
        this.id = id;
        this.name = name;
        this.description = description;
        this.category = category;
        this.severity = severity;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public AttackCategory getCategory() {
        return category;
    }

    public Severity getSeverity() {
        return severity;
    }

    public Set<String> applicablePrograms() {
        return ALL_PROGRAMS;
    }

    /**
     * Операции, без которых сценарий к программе не применяется
     */
    public Set<Capability> requiredCapabilities() {
        return Set.of();
    }

    public boolean supports(TargetProgram target) {
        return target.getCapabilities().supportsAll(requiredCapabilities());
    }

    public abstract CandidateTransaction build(TargetProgram target, ScenarioContext context);

    /**
     * Аккаунты для снимков до/после: атакующий и watch-аккаунты цели
     */
    public List<String> watchedAccounts(TargetProgram target, ScenarioContext context) {
        Set<String> addresses = new LinkedHashSet<>();
        addresses.add(context.getAttacker().address());
        addWatchAccounts(addresses, target, context);
        return new ArrayList<>(addresses);
    }

    protected static void addWatchAccounts(Set<String> addresses, TargetProgram target, ScenarioContext context) {
        BuildContext buildContext = context.buildContext(target);
        for (AuditorConfig.AccountTemplate template : target.getWatchAccounts()) {
            addresses.add(buildContext.resolve(template));
        }
    }

    protected Instruction invoke(TargetProgram target, ScenarioContext context,
                                 Capability capability, InstructionArgs args) {
        return target.getCapabilities().require(capability).build(context.buildContext(target), args);
    }

    /**
     * Комиссию платит отдельный пополненный ключ, подписантом инструкций остается атакующий
     */
    protected CandidateTransaction.CandidateTransactionBuilder transaction(ScenarioContext context) {
        SignerIdentity payer = context.payer();
        CandidateTransaction.CandidateTransactionBuilder builder = CandidateTransaction.builder()
            .feePayer(payer.address())
            .signer(payer)
            .label(id);
        if (payer != context.getAttacker()) {
            builder.signer(context.getAttacker());
        }
        return builder;
    }

    @Override
    public String toString() {
        return id + " [" + category.getWireName() + "/" + severity.wireName() + "]";
    }
}
