package com.vtb.auditor.scenario.attacks;

import com.vtb.auditor.catalog.TargetProgram;
import com.vtb.auditor.chain.AccountMeta;
import com.vtb.auditor.chain.CandidateTransaction;
import com.vtb.auditor.chain.Instruction;
import com.vtb.auditor.chain.PublicKeys;
import com.vtb.auditor.scenario.ScenarioContext;

import java.util.List;

/**
 * Лимит compute units поднят до максимума 1.4M, затем повторные вызовы программы
 */
public class ComputeExhaustionScenario extends ResourceExhaustionScenario {

    static final int MAX_COMPUTE_UNITS = 1_400_000;
    private static final byte SET_COMPUTE_UNIT_LIMIT = 2;

    public ComputeExhaustionScenario() {
        super("dos-compute-exhaustion",
            "Compute Exhaustion",
            "Raises the compute budget to the 1.4M maximum and repeats program calls to exhaust it");
    }

    @Override
    public CandidateTransaction build(TargetProgram target, ScenarioContext context) {
        int repeats = context.parameter("compute_repeat_count", 5).intValueExact();
        Instruction instruction = cheapestInstruction(target, context);
        CandidateTransaction.CandidateTransactionBuilder builder = transaction(context)
            .instruction(setComputeUnitLimit(MAX_COMPUTE_UNITS));
        for (int i = 0; i < repeats; i++) {
            builder.instruction(instruction);
        }
        return builder.build();
    }

    static Instruction setComputeUnitLimit(int units) {
        byte[] data = new byte[5];
        data[0] = SET_COMPUTE_UNIT_LIMIT;
        for (int i = 0; i < 4; i++) {
            data[1 + i] = (byte) (units >>> (8 * i));
        }
        return new Instruction(PublicKeys.COMPUTE_BUDGET_PROGRAM, List.<AccountMeta>of(), data);
    }
}
