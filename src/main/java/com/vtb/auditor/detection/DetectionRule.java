package com.vtb.auditor.detection;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.vtb.auditor.models.Severity;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.function.Predicate;

/**
 * Описание правила детектора. Предикат должен быть чистой функцией от контекста.
 */
@Value
@Builder
public class DetectionRule {
    @NonNull
    String id;
    String name;
    String description;
    RuleCategory category;
    Severity severity;
    @JsonIgnore
    @NonNull
    Predicate<DetectionContext> predicate;

    public boolean evaluate(DetectionContext context) {
        return predicate.test(context);
    }
}
