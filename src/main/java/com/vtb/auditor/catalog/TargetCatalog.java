package com.vtb.auditor.catalog;

import com.vtb.auditor.chain.PublicKeys;
import com.vtb.auditor.core.RegistrationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Реестр программ-целей, порядок регистрации сохраняется
 */
public class TargetCatalog {

    private final Map<String, TargetProgram> programs = new LinkedHashMap<>();

    public TargetCatalog register(TargetProgram program) {
        if (program.getName() == null || program.getName().isBlank()) {
            throw new RegistrationException("Программа без имени: " + program.getAddress());
        }
        if (!PublicKeys.isValid(program.getAddress())) {
            throw new RegistrationException("Некорректный адрес программы " + program.getName()
                + ": " + program.getAddress());
        }
        if (programs.containsKey(program.getName())) {
            throw new RegistrationException("Программа уже зарегистрирована: " + program.getName());
        }
        programs.put(program.getName(), program);
        return this;
    }

    public Optional<TargetProgram> find(String name) {
        return Optional.ofNullable(programs.get(name));
    }

    public boolean contains(String name) {
        return programs.containsKey(name);
    }

    public List<TargetProgram> all() {
        return new ArrayList<>(programs.values());
    }

    public int size() {
        return programs.size();
    }
}
