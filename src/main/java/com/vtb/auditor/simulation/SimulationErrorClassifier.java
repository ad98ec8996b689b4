package com.vtb.auditor.simulation;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Классификация поля err ответа симуляции.
 * InstructionError и прочие отказы рантайма - блокировка атаки,
 * ошибки загрузки транзакции - проблема окружения.
 */
public final class SimulationErrorClassifier {

    private static final Set<String> ENVIRONMENT_ERRORS = Set.of(
        "AccountNotFound",
        "ProgramAccountNotFound",
        "BlockhashNotFound",
        "InsufficientFundsForFee",
        "InvalidAccountForFee",
        "AlreadyProcessed",
        "AccountInUse",
        "AccountLoadedTwice",
        "InvalidProgramForExecution",
        "SanitizeFailure",
        "ClusterMaintenance",
        "UnsupportedVersion",
        "WouldExceedMaxBlockCostLimit",
        "WouldExceedMaxAccountCostLimit",
        "WouldExceedAccountDataBlockLimit",
        "TooManyAccountLocks",
        "ResanitizationNeeded"
    );

    private static final Pattern ANCHOR_ERROR = Pattern.compile(
        "Error Code: (\\w+)\\. Error Number: (\\d+)\\. Error Message: (.*?)\\.?$");
    private static final Pattern CUSTOM_ERROR = Pattern.compile("custom program error: (0x[0-9a-fA-F]+)");

    private SimulationErrorClassifier() {
    }

    public static ErrorDescriptor classify(JsonNode err, List<String> logs) {
        if (err == null || err.isNull()) {
            return null;
        }
        if (err.isTextual()) {
            String name = err.asText();
            return ErrorDescriptor.builder()
                .kind(ENVIRONMENT_ERRORS.contains(name) ? ErrorDescriptor.Kind.ENVIRONMENT
                    : ErrorDescriptor.Kind.PROGRAM_REJECTION)
                .errorName(name)
                .raw(err.toString())
                .build();
        }

        JsonNode instructionError = err.get("InstructionError");
        if (instructionError != null && instructionError.isArray() && instructionError.size() == 2) {
            ErrorDescriptor.ErrorDescriptorBuilder builder = ErrorDescriptor.builder()
                .kind(ErrorDescriptor.Kind.PROGRAM_REJECTION)
                .instructionIndex(instructionError.get(0).asInt())
                .raw(err.toString());
            JsonNode detail = instructionError.get(1);
            if (detail.isTextual()) {
                builder.errorName(detail.asText());
            } else if (detail.has("Custom")) {
                builder.customCode(detail.get("Custom").asLong()).errorName("Custom");
            } else if (detail.isObject() && detail.fieldNames().hasNext()) {
                String name = detail.fieldNames().next();
                builder.errorName(name).message(detail.get(name).asText(null));
            }
            applyAnchorDetails(builder, logs);
            return builder.build();
        }

        String name = err.isObject() && err.fieldNames().hasNext() ? err.fieldNames().next() : err.toString();
        return ErrorDescriptor.builder()
            .kind(ENVIRONMENT_ERRORS.contains(name) ? ErrorDescriptor.Kind.ENVIRONMENT
                : ErrorDescriptor.Kind.PROGRAM_REJECTION)
            .errorName(name)
            .raw(err.toString())
            .build();
    }

    private static void applyAnchorDetails(ErrorDescriptor.ErrorDescriptorBuilder builder, List<String> logs) {
        if (logs == null) {
            return;
        }
        for (String line : logs) {
            Matcher anchor = ANCHOR_ERROR.matcher(line);
            if (anchor.find()) {
                builder.errorName(anchor.group(1))
                    .customCode(Long.parseLong(anchor.group(2)))
                    .message(anchor.group(3));
                return;
            }
        }
        for (String line : logs) {
            Matcher custom = CUSTOM_ERROR.matcher(line);
            if (custom.find()) {
                builder.message(line.trim());
                return;
            }
        }
    }
}
