package com.vtb.auditor.catalog;

import com.vtb.auditor.chain.InstructionBuildException;
import com.vtb.auditor.chain.ProgramAddress;
import com.vtb.auditor.chain.PublicKeys;
import com.vtb.auditor.chain.SignerIdentity;
import com.vtb.auditor.config.AuditorConfig.AccountTemplate;
import org.bouncycastle.util.encoders.Hex;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Разрешение ролей и шаблонов аккаунтов для одной программы-цели.
 * Роли: signer/attacker, program, системные программы, program:&lt;имя&gt; и известные аккаунты из конфига.
 */
public class BuildContext {

    private final TargetProgram target;
    private final SignerIdentity signer;
    private final Map<String, String> knownAccounts;
    private final TargetCatalog catalog;

    public BuildContext(TargetProgram target, SignerIdentity signer, Map<String, String> knownAccounts,
                        TargetCatalog catalog) {
        this.target = target;
        this.signer = signer;
        this.knownAccounts = knownAccounts != null ? knownAccounts : Map.of();
        this.catalog = catalog;
    }

    public TargetProgram getTarget() {
        return target;
    }

    public SignerIdentity getSigner() {
        return signer;
    }

    /**
     * Тот же контекст, но для другой программы каталога
     */
    public BuildContext forTarget(TargetProgram other) {
        return new BuildContext(other, signer, knownAccounts, catalog);
    }

    public String resolveRole(String role) {
        if (role == null || role.isBlank()) {
            throw new InstructionBuildException("Пустая роль аккаунта для " + target.getName());
        }
        String normalized = role.trim();
        switch (normalized.toLowerCase(Locale.ROOT)) {
            case "signer", "attacker":
                return signer.address();
            case "program", "target":
                return target.getAddress();
            case "system_program":
                return PublicKeys.SYSTEM_PROGRAM;
            case "token_program":
                return PublicKeys.TOKEN_PROGRAM;
            case "associated_token_program":
                return PublicKeys.ASSOCIATED_TOKEN_PROGRAM;
            case "compute_budget_program":
                return PublicKeys.COMPUTE_BUDGET_PROGRAM;
            case "sysvar_clock":
                return PublicKeys.SYSVAR_CLOCK;
            case "sysvar_rent":
                return PublicKeys.SYSVAR_RENT;
            default:
                break;
        }
        if (normalized.startsWith("program:")) {
            String programName = normalized.substring("program:".length());
            if (catalog == null) {
                throw new InstructionBuildException("Каталог программ недоступен для роли " + role);
            }
            return catalog.find(programName)
                .map(TargetProgram::getAddress)
                .orElseThrow(() -> new InstructionBuildException("Неизвестная программа в роли " + role));
        }
        String known = knownAccounts.get(normalized);
        if (known != null && !known.isBlank()) {
            return known;
        }
        throw new InstructionBuildException("Не удалось разрешить аккаунт '" + role + "' для " + target.getName());
    }

    public String resolve(AccountTemplate template, Map<String, String> overrides) {
        if (template.getName() != null && overrides != null && overrides.containsKey(template.getName())) {
            return overrides.get(template.getName());
        }
        if (template.getAddress() != null && !template.getAddress().isBlank()) {
            return template.getAddress().trim();
        }
        if (template.getSeeds() != null && !template.getSeeds().isEmpty()) {
            String programId = template.getSeedProgram() != null
                ? resolveRole(template.getSeedProgram())
                : target.getAddress();
            List<byte[]> seeds = new ArrayList<>();
            for (String seed : template.getSeeds()) {
                seeds.add(resolveSeed(seed));
            }
            return ProgramAddress.find(seeds, programId).address();
        }
        if (template.getRole() != null) {
            return resolveRole(template.getRole());
        }
        throw new InstructionBuildException("Аккаунт '" + template.getName() + "' без адреса, роли и seeds");
    }

    public String resolve(AccountTemplate template) {
        return resolve(template, Map.of());
    }

    private byte[] resolveSeed(String seed) {
        int separator = seed.indexOf(':');
        if (separator < 0) {
            return seed.getBytes(StandardCharsets.UTF_8);
        }
        String kind = seed.substring(0, separator).toLowerCase(Locale.ROOT);
        String value = seed.substring(separator + 1);
        return switch (kind) {
            case "str" -> value.getBytes(StandardCharsets.UTF_8);
            case "role" -> PublicKeys.decode(resolveRole(value));
            case "pubkey" -> PublicKeys.decode(value);
            case "hex" -> Hex.decode(value);
            case "u64" -> {
                byte[] bytes = new byte[8];
                BigInteger number = new BigInteger(value);
                for (int i = 0; i < 8; i++) {
                    bytes[i] = (byte) number.shiftRight(8 * i).intValue();
                }
                yield bytes;
            }
            default -> throw new InstructionBuildException("Неизвестный тип seed: " + seed);
        };
    }
}
