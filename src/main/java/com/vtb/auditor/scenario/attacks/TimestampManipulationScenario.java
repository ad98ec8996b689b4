package com.vtb.auditor.scenario.attacks;

import com.vtb.auditor.catalog.Capability;
import com.vtb.auditor.catalog.InstructionArgs;
import com.vtb.auditor.catalog.TargetProgram;
import com.vtb.auditor.chain.CandidateTransaction;
import com.vtb.auditor.models.AttackCategory;
import com.vtb.auditor.models.Severity;
import com.vtb.auditor.scenario.AttackScenario;
import com.vtb.auditor.scenario.ScenarioContext;

import java.time.Duration;
import java.util.Set;

/**
 * Обновление цены/ставки наград с меткой времени далеко в будущем
 */
public class TimestampManipulationScenario extends AttackScenario {

    static final Duration FUTURE_SKEW = Duration.ofDays(365);

    public TimestampManipulationScenario() {
        super("oracle-timestamp-manipulation",
            "Timestamp Manipulation",
            "Pushes a price or reward update stamped far in the future",
            AttackCategory.ORACLE, Severity.HIGH);
    }

    @Override
    public Set<Capability> requiredCapabilities() {
        return Set.of(Capability.PRICE_UPDATE);
    }

    @Override
    public CandidateTransaction build(TargetProgram target, ScenarioContext context) {
        long futureTimestamp = context.now().plus(FUTURE_SKEW).getEpochSecond();
        InstructionArgs args = InstructionArgs.builder()
            .value(ArgumentNames.PRICE, context.parameter("reference_price", 1_000_000L))
            .value(ArgumentNames.TIMESTAMP, futureTimestamp)
            .build();
        return transaction(context)
            .instruction(invoke(target, context, Capability.PRICE_UPDATE, args))
            .build();
    }
}
