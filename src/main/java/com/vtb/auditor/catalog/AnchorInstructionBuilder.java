package com.vtb.auditor.catalog;

import com.vtb.auditor.chain.AccountMeta;
import com.vtb.auditor.chain.Instruction;
import com.vtb.auditor.chain.InstructionBuildException;
import com.vtb.auditor.chain.PublicKeys;
import com.vtb.auditor.config.AuditorConfig;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.util.encoders.Hex;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Сборка инструкции Anchor-программы по шаблону из конфигурации:
 * данные = sha256("global:" + method)[0..8] + аргументы в Borsh.
 */
@Slf4j
public class AnchorInstructionBuilder implements InstructionBuilder {

    private final AuditorConfig.InstructionTemplate template;
    private final byte[] discriminator;

    public AnchorInstructionBuilder(AuditorConfig.InstructionTemplate template) {
        if (template.getMethod() == null || template.getMethod().isBlank()) {
            throw new IllegalArgumentException("В шаблоне инструкции не задан method");
        }
        this.template = template;
        this.discriminator = template.getDiscriminatorHex() != null
            ? Hex.decode(template.getDiscriminatorHex())
            : discriminator("global", template.getMethod());
    }

    public static byte[] discriminator(String namespace, String name) {
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256")
                .digest((namespace + ":" + name).getBytes(StandardCharsets.UTF_8));
            return Arrays.copyOf(hash, 8);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }

    public String getMethod() {
        return template.getMethod();
    }

    @Override
    public Instruction build(BuildContext context, InstructionArgs args) {
        InstructionArgs effective = args != null ? args : InstructionArgs.none();
        List<AccountMeta> accounts = new ArrayList<>();
        for (AuditorConfig.AccountTemplate account : template.getAccounts()) {
            String address = context.resolve(account, effective.getAccountOverrides());
            accounts.add(new AccountMeta(address, account.isSigner(), account.isWritable()));
        }

        BorshWriter writer = new BorshWriter().writeRaw(discriminator);
        for (AuditorConfig.ArgTemplate arg : template.getArgs()) {
            Object value = effective.getValues().containsKey(arg.getName())
                ? effective.getValues().get(arg.getName())
                : arg.getDefaultValue();
            if (value == null) {
                throw new InstructionBuildException("Не задан аргумент " + arg.getName()
                    + " для " + template.getMethod());
            }
            encode(writer, arg, value, context);
        }
        if (log.isDebugEnabled()) {
            effective.getValues().keySet().stream()
                .filter(name -> template.getArgs().stream().noneMatch(arg -> name.equals(arg.getName())))
                .forEach(name -> log.debug("Аргумент {} не используется шаблоном {}", name, template.getMethod()));
        }
        return new Instruction(context.getTarget().getAddress(), accounts, writer.toByteArray());
    }

    private void encode(BorshWriter writer, AuditorConfig.ArgTemplate arg, Object value, BuildContext context) {
        String type = arg.getType() != null ? arg.getType().toLowerCase(Locale.ROOT) : "u64";
        encode(writer, arg.getName(), type, value, context);
    }

    private void encode(BorshWriter writer, String name, String type, Object value, BuildContext context) {
        if (type.startsWith("option:")) {
            // Borsh Option: тег 0 для None, 1 и значение для Some
            if ("none".equalsIgnoreCase(String.valueOf(value).trim())) {
                writer.writeUnsigned(BigInteger.ZERO, 1, name);
            } else {
                writer.writeUnsigned(BigInteger.ONE, 1, name);
                encode(writer, name, type.substring("option:".length()), value, context);
            }
            return;
        }
        switch (type) {
            case "u8" -> writer.writeUnsigned(toBigInteger(name, value), 1, name);
            case "u16" -> writer.writeUnsigned(toBigInteger(name, value), 2, name);
            case "u32" -> writer.writeUnsigned(toBigInteger(name, value), 4, name);
            case "u64" -> writer.writeUnsigned(toBigInteger(name, value), 8, name);
            case "u128" -> writer.writeUnsigned(toBigInteger(name, value), 16, name);
            case "i32" -> writer.writeSigned(toBigInteger(name, value), 4, name);
            case "i64" -> writer.writeSigned(toBigInteger(name, value), 8, name);
            case "bool" -> writer.writeBool(Boolean.parseBoolean(String.valueOf(value)));
            case "string" -> writer.writeString(String.valueOf(value));
            case "pubkey" -> writer.writeRaw(toPublicKey(name, value, context));
            default -> throw new InstructionBuildException("Неподдерживаемый тип аргумента " + type);
        }
    }

    private BigInteger toBigInteger(String name, Object value) {
        if (value instanceof BigInteger big) {
            return big;
        }
        if (value instanceof Number number) {
            return BigInteger.valueOf(number.longValue());
        }
        try {
            return new BigInteger(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new InstructionBuildException("Аргумент " + name + " не число: " + value, e);
        }
    }

    private byte[] toPublicKey(String name, Object value, BuildContext context) {
        String text = String.valueOf(value).trim();
        String address = text.startsWith("role:") ? context.resolveRole(text.substring(5)) : text;
        try {
            return PublicKeys.decode(address);
        } catch (IllegalArgumentException e) {
            throw new InstructionBuildException("Аргумент " + name + " не является адресом: " + value, e);
        }
    }
}
