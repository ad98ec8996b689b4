package com.vtb.auditor.snapshot;

import com.vtb.auditor.catalog.AnchorInstructionBuilder;
import com.vtb.auditor.chain.AccountInfo;
import com.vtb.auditor.config.AuditorConfig;
import org.bouncycastle.util.encoders.Hex;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Декодер Anchor-аккаунта программы-цели по раскладке полей из конфигурации.
 * Аккаунт распознается по владельцу и дискриминатору sha256("account:" + name)[0..8].
 */
public class LayoutAccountDecoder implements AccountDecoder {

    private final String programId;
    private final AuditorConfig.AccountLayout layout;
    private final byte[] discriminator;

    public LayoutAccountDecoder(String programId, AuditorConfig.AccountLayout layout) {
        this.programId = programId;
        this.layout = layout;
        this.discriminator = layout.getDiscriminatorHex() != null
            ? Hex.decode(layout.getDiscriminatorHex())
            : AnchorInstructionBuilder.discriminator("account", layout.getName());
    }

    @Override
    public String name() {
        return layout.getName();
    }

    @Override
    public boolean supports(AccountInfo account) {
        if (!programId.equals(account.getOwner()) || account.dataSize() < discriminator.length) {
            return false;
        }
        return Arrays.equals(Arrays.copyOf(account.getData(), discriminator.length), discriminator);
    }

    @Override
    public DecodedAccount decode(AccountInfo account) {
        byte[] data = account.getData();
        Map<String, BigInteger> balances = new LinkedHashMap<>();
        Map<String, String> fields = new LinkedHashMap<>();
        for (AuditorConfig.FieldLayout field : layout.getFields()) {
            String type = field.getType() != null ? field.getType().toLowerCase(Locale.ROOT) : "u64";
            int size = sizeOf(type);
            if (field.getOffset() < 0 || field.getOffset() + size > data.length) {
                continue;
            }
            if ("pubkey".equals(type)) {
                fields.put(field.getName(), ByteReader.readPublicKey(data, field.getOffset()));
                continue;
            }
            if ("bool".equals(type)) {
                fields.put(field.getName(), String.valueOf(data[field.getOffset()] != 0));
                continue;
            }
            BigInteger value = type.startsWith("i")
                ? ByteReader.readSigned(data, field.getOffset(), size)
                : ByteReader.readUnsigned(data, field.getOffset(), size);
            fields.put(field.getName(), value.toString());
            if (field.isBalance()) {
                balances.put(field.getName(), value);
            }
        }
        return new DecodedAccount(balances, fields);
    }

    private static int sizeOf(String type) {
        return switch (type) {
            case "pubkey" -> 32;
            case "u8", "bool" -> 1;
            case "u16" -> 2;
            case "u32", "i32" -> 4;
            case "u128" -> 16;
            default -> 8;
        };
    }
}
