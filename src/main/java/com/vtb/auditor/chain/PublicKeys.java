package com.vtb.auditor.chain;

import org.bitcoinj.core.AddressFormatException;
import org.bitcoinj.core.Base58;

/**
 * Работа с base58-адресами Solana (32 байта ключа)
 */
public final class PublicKeys {

    public static final int KEY_LENGTH = 32;

    public static final String SYSTEM_PROGRAM = "11111111111111111111111111111111";
    public static final String TOKEN_PROGRAM = "TokenkegQfeZyiNwAJbNbGKPFXCWuBvf9Ss623VQ5DA";
    public static final String ASSOCIATED_TOKEN_PROGRAM = "ATokenGPvbdGVxr1b2hvZbsiqW5xWH25efTNsLJA8knL";
    public static final String COMPUTE_BUDGET_PROGRAM = "ComputeBudget111111111111111111111111111111";
    public static final String SYSVAR_CLOCK = "SysvarC1ock11111111111111111111111111111111";
    public static final String SYSVAR_RENT = "SysvarRent111111111111111111111111111111111";

    private PublicKeys() {
    }

    public static byte[] decode(String address) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("Пустой адрес");
        }
        byte[] bytes;
        try {
            bytes = Base58.decode(address.trim());
        } catch (AddressFormatException e) {
            throw new IllegalArgumentException("Некорректный base58 адрес: " + address, e);
        }
        if (bytes.length != KEY_LENGTH) {
            throw new IllegalArgumentException("Адрес должен содержать 32 байта, получено "
                + bytes.length + ": " + address);
        }
        return bytes;
    }

    public static String encode(byte[] key) {
        if (key == null || key.length != KEY_LENGTH) {
            throw new IllegalArgumentException("Ключ должен содержать 32 байта");
        }
        return Base58.encode(key);
    }

    public static boolean isValid(String address) {
        try {
            decode(address);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
