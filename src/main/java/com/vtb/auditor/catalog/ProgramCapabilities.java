package com.vtb.auditor.catalog;

import com.vtb.auditor.chain.InstructionBuildException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Набор операций программы-цели и сборщики инструкций для них
 */
public class ProgramCapabilities {

    private final String programName;
    private final Map<Capability, InstructionBuilder> builders;

    public ProgramCapabilities(String programName, Map<Capability, InstructionBuilder> builders) {
        this.programName = programName;
        this.builders = builders.isEmpty()
            ? new EnumMap<>(Capability.class)
            : new EnumMap<>(builders);
    }

    public boolean supports(Capability capability) {
        return builders.containsKey(capability);
    }

    public boolean supportsAll(Set<Capability> capabilities) {
        return builders.keySet().containsAll(capabilities);
    }

    public InstructionBuilder require(Capability capability) {
        InstructionBuilder builder = builders.get(capability);
        if (builder == null) {
            throw new InstructionBuildException("Программа " + programName + " не поддерживает операцию "
                + capability.key());
        }
        return builder;
    }

    public Set<Capability> available() {
        return Collections.unmodifiableSet(builders.keySet());
    }
}
