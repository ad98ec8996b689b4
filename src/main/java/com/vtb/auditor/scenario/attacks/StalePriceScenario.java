package com.vtb.auditor.scenario.attacks;

import com.vtb.auditor.catalog.Capability;
import com.vtb.auditor.catalog.InstructionArgs;
import com.vtb.auditor.catalog.TargetProgram;
import com.vtb.auditor.chain.CandidateTransaction;
import com.vtb.auditor.models.AttackCategory;
import com.vtb.auditor.models.Severity;
import com.vtb.auditor.scenario.AttackScenario;
import com.vtb.auditor.scenario.ScenarioContext;

import java.math.BigInteger;
import java.time.Duration;
import java.util.Set;

public class StalePriceScenario extends AttackScenario {

    static final Duration STALENESS = Duration.ofDays(30);
    static final long PRICE_MULTIPLIER = 1_000L;

    public StalePriceScenario() {
        super("oracle-stale-price",
            "Stale Extreme Price",
            "Submits a price update with an old timestamp and an extreme price value",
            AttackCategory.ORACLE, Severity.HIGH);
    }

    @Override
    public Set<Capability> requiredCapabilities() {
        return Set.of(Capability.PRICE_UPDATE);
    }

    @Override
    public CandidateTransaction build(TargetProgram target, ScenarioContext context) {
        BigInteger extremePrice = context.parameter("reference_price", 1_000_000L)
            .multiply(BigInteger.valueOf(PRICE_MULTIPLIER));
        long staleTimestamp = context.now().minus(STALENESS).getEpochSecond();
        InstructionArgs args = InstructionArgs.builder()
            .value(ArgumentNames.PRICE, extremePrice)
            .value(ArgumentNames.TIMESTAMP, staleTimestamp)
            .build();
        return transaction(context)
            .instruction(invoke(target, context, Capability.PRICE_UPDATE, args))
            .build();
    }
}
