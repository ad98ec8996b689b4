package com.vtb.auditor.execution.checks;

import com.vtb.auditor.detection.DetectionContext;
import com.vtb.auditor.detection.DetectionEngine;
import com.vtb.auditor.detection.RuleMatch;
import com.vtb.auditor.execution.InfrastructureCheck;
import com.vtb.auditor.execution.InfrastructureCheckOutcome;

import java.util.List;

/**
 * Детектор молчит на пустом контексте и реагирует на заведомо аномальный
 */
public class DetectionEngineCheck implements InfrastructureCheck {

    private final DetectionEngine engine;

    public DetectionEngineCheck(DetectionEngine engine) {
        this.engine = engine;
    }

    @Override
    public String id() {
        return "infra-detection-engine";
    }

    @Override
    public String name() {
        return "Detection Engine";
    }

    @Override
    public InfrastructureCheckOutcome run() {
        List<RuleMatch> quiet = engine.evaluate(DetectionContext.baseline());
        if (!quiet.isEmpty()) {
            return InfrastructureCheckOutcome.failed(quiet.size() + " rules fire on an empty context");
        }
        DetectionContext anomalous = DetectionContext.baseline().toBuilder()
            .logs(List.of("Program log: panicked at 'attempt to add with overflow'"))
            .resourceUnitsConsumed(1_400_000L)
            .build();
        List<RuleMatch> loud = engine.evaluate(anomalous);
        if (loud.isEmpty()) {
            return InfrastructureCheckOutcome.failed("No rule fires on a synthetic anomalous context");
        }
        return InfrastructureCheckOutcome.ok(engine.getRegistry().size() + " rules registered, "
            + loud.size() + " fire on the synthetic anomaly");
    }
}
