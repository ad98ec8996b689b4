package com.vtb.auditor.scenario;

import com.vtb.auditor.catalog.BuildContext;
import com.vtb.auditor.catalog.TargetCatalog;
import com.vtb.auditor.catalog.TargetProgram;
import com.vtb.auditor.chain.InstructionBuildException;
import com.vtb.auditor.chain.ProgramAddress;
import com.vtb.auditor.chain.PublicKeys;
import com.vtb.auditor.chain.SignerIdentity;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Окружение сборки атак: одноразовый ключ атакующего, известные адреса,
 * параметры сценариев и каталог программ для межпрограммных цепочек.
 */
@Value
@Builder
public class ScenarioContext {

    public static final String TOKEN_MINT_KEY = "token_mint";

    SignerIdentity attacker;
    /**
     * Пополненный аккаунт для оплаты комиссий, null - платит атакующий
     */
    SignerIdentity feePayer;
    @Builder.Default
    Map<String, String> knownAccounts = new LinkedHashMap<>();
    @Builder.Default
    Map<String, String> parameters = new LinkedHashMap<>();
    TargetCatalog catalog;
    @Builder.Default
    Clock clock = Clock.systemUTC();

    public BuildContext buildContext(TargetProgram target) {
        return new BuildContext(target, attacker, knownAccounts, catalog);
    }

    public SignerIdentity payer() {
        return feePayer != null ? feePayer : attacker;
    }

    public Instant now() {
        return clock.instant();
    }

    public BigInteger parameter(String name, long defaultValue) {
        String value = parameters.get(name);
        if (value == null || value.isBlank()) {
            return BigInteger.valueOf(defaultValue);
        }
        try {
            return new BigInteger(value.trim());
        } catch (NumberFormatException e) {
            throw new InstructionBuildException("Параметр " + name + " не число: " + value, e);
        }
    }

    public String textParameter(String name, String defaultValue) {
        String value = parameters.get(name);
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }

    /**
     * Associated token account атакующего для mint из known-аккаунтов
     */
    public String attackerTokenAccount() {
        String mint = knownAccounts.get(TOKEN_MINT_KEY);
        if (mint == null) {
            throw new InstructionBuildException("Не задан аккаунт " + TOKEN_MINT_KEY + " для токен-аккаунта атакующего");
        }
        return ProgramAddress.find(List.of(
            PublicKeys.decode(attacker.address()),
            PublicKeys.decode(PublicKeys.TOKEN_PROGRAM),
            PublicKeys.decode(mint)), PublicKeys.ASSOCIATED_TOKEN_PROGRAM).address();
    }
}
