package com.vtb.auditor.scenario.attacks;

import com.vtb.auditor.catalog.Capability;
import com.vtb.auditor.catalog.InstructionArgs;
import com.vtb.auditor.catalog.TargetProgram;
import com.vtb.auditor.chain.CandidateTransaction;
import com.vtb.auditor.chain.Instruction;
import com.vtb.auditor.chain.InstructionBuildException;
import com.vtb.auditor.models.AttackCategory;
import com.vtb.auditor.models.Severity;
import com.vtb.auditor.scenario.AttackScenario;
import com.vtb.auditor.scenario.ScenarioContext;

import java.util.List;

/**
 * Транзакция из множества инструкций (по умолчанию 11) к одной программе
 */
public class ResourceExhaustionScenario extends AttackScenario {

    static final int DEFAULT_INSTRUCTION_COUNT = 11;

    // от самой дешевой операции к самой тяжелой
    static final List<Capability> PREFERRED = List.of(
        Capability.CLAIM, Capability.SWAP, Capability.FUNDING,
        Capability.WITHDRAW, Capability.PRICE_UPDATE, Capability.PRIVILEGED_OPERATION);

    public ResourceExhaustionScenario() {
        super("dos-resource-exhaustion",
            "Resource Exhaustion",
            "Packs many instructions into a single transaction to exhaust resource limits",
            AttackCategory.DOS, Severity.MEDIUM);
    }

    protected ResourceExhaustionScenario(String id, String name, String description) {
        super(id, name, description, AttackCategory.DOS, Severity.MEDIUM);
    }

    @Override
    public boolean supports(TargetProgram target) {
        return PREFERRED.stream().anyMatch(target.getCapabilities()::supports);
    }

    @Override
    public CandidateTransaction build(TargetProgram target, ScenarioContext context) {
        int count = context.parameter("dos_instruction_count", DEFAULT_INSTRUCTION_COUNT).intValueExact();
        Instruction instruction = cheapestInstruction(target, context);
        CandidateTransaction.CandidateTransactionBuilder builder = transaction(context);
        for (int i = 0; i < count; i++) {
            builder.instruction(instruction);
        }
        return builder.build();
    }

    Instruction cheapestInstruction(TargetProgram target, ScenarioContext context) {
        Capability capability = PREFERRED.stream()
            .filter(target.getCapabilities()::supports)
            .findFirst()
            .orElseThrow(() -> new InstructionBuildException(
                "Программа " + target.getName() + " не поддерживает ни одной операции"));
        InstructionArgs args = InstructionArgs.builder()
            .value(ArgumentNames.AMOUNT, context.parameter("dos_amount", 1L))
            .build();
        return invoke(target, context, capability, args);
    }
}
